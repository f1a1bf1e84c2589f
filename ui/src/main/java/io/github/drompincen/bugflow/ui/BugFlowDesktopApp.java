package io.github.drompincen.bugflow.ui;

import com.formdev.flatlaf.FlatDarkLaf;
import io.github.drompincen.bugflow.ui.view.MainWindow;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

import javax.swing.*;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.bugflow")
@EnableMongoRepositories(basePackages = "io.github.drompincen.bugflow.persistence.repository")
public class BugFlowDesktopApp {

    public static void main(String[] args) {
        FlatDarkLaf.setup();

        UIManager.put("Component.focusWidth", 1);
        UIManager.put("Button.arc", 6);
        UIManager.put("Component.arrowType", "triangle");

        ConfigurableApplicationContext ctx = new SpringApplicationBuilder(BugFlowDesktopApp.class)
                .web(WebApplicationType.NONE)
                .headless(false)
                .run(args);

        SwingUtilities.invokeLater(() -> {
            MainWindow mainWindow = ctx.getBean(MainWindow.class);
            JFrame frame = new JFrame("BugFlow");
            frame.setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);
            frame.setContentPane(mainWindow);
            frame.setSize(1400, 900);
            frame.setLocationRelativeTo(null);
            frame.setVisible(true);

            frame.addWindowListener(new java.awt.event.WindowAdapter() {
                @Override
                public void windowClosing(java.awt.event.WindowEvent e) {
                    ctx.close();
                }
            });
        });
    }
}
