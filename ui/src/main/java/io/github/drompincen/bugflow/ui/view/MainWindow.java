package io.github.drompincen.bugflow.ui.view;

import io.github.drompincen.bugflow.persistence.document.ProjectDocument;
import io.github.drompincen.bugflow.persistence.document.UserDocument;
import io.github.drompincen.bugflow.persistence.stream.ChangeStreamService;
import io.github.drompincen.bugflow.runtime.directory.ProjectService;
import io.github.drompincen.bugflow.runtime.directory.UserService;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Component;

import javax.swing.*;
import java.awt.*;
import java.util.List;

@Component
public class MainWindow extends JPanel {

    private final ProjectService projectService;
    private final UserService userService;
    private final ChangeStreamService changeStreamService;
    private final BoardView boardView;

    private final DefaultListModel<ProjectDocument> projectListModel = new DefaultListModel<>();
    private final JList<ProjectDocument> projectList = new JList<>(projectListModel);
    private final JComboBox<UserDocument> userSelector = new JComboBox<>();
    private final JLabel statusLabel = new JLabel("Ready");

    public MainWindow(ProjectService projectService, UserService userService,
                      ChangeStreamService changeStreamService, BoardView boardView) {
        this.projectService = projectService;
        this.userService = userService;
        this.changeStreamService = changeStreamService;
        this.boardView = boardView;
    }

    @PostConstruct
    public void init() {
        setLayout(new BorderLayout());
        buildLayout();
        loadProjects();
        loadUsers();
        changeStreamService.watchInserts("projects", ProjectDocument.class)
                .subscribe(doc -> loadProjects());
    }

    private void buildLayout() {
        JPanel sidebar = new JPanel(new BorderLayout(0, 8));
        sidebar.setPreferredSize(new Dimension(200, 0));
        sidebar.setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));

        JLabel projectsLabel = new JLabel("Projects");
        projectsLabel.setFont(projectsLabel.getFont().deriveFont(Font.BOLD, 14f));
        sidebar.add(projectsLabel, BorderLayout.NORTH);

        projectList.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        projectList.setCellRenderer(new DefaultListCellRenderer() {
            @Override
            public java.awt.Component getListCellRendererComponent(JList<?> list, Object value, int index,
                                                                   boolean selected, boolean focus) {
                String name = value instanceof ProjectDocument p ? p.getName() : String.valueOf(value);
                return super.getListCellRendererComponent(list, name, index, selected, focus);
            }
        });
        projectList.addListSelectionListener(e -> {
            if (!e.getValueIsAdjusting() && projectList.getSelectedValue() != null) {
                selectProject(projectList.getSelectedValue());
            }
        });
        sidebar.add(new JScrollPane(projectList), BorderLayout.CENTER);
        add(sidebar, BorderLayout.WEST);

        JPanel toolbar = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 4));
        toolbar.add(new JLabel("Acting as:"));
        userSelector.setRenderer(new DefaultListCellRenderer() {
            @Override
            public java.awt.Component getListCellRendererComponent(JList<?> list, Object value, int index,
                                                                   boolean selected, boolean focus) {
                String text = value instanceof UserDocument u
                        ? u.getName() + " (" + u.getRole().label() + ")"
                        : "";
                return super.getListCellRendererComponent(list, text, index, selected, focus);
            }
        });
        userSelector.addActionListener(e -> {
            UserDocument user = (UserDocument) userSelector.getSelectedItem();
            boardView.setActor(user != null ? Actor.of(user.getUserId(), user.getRole()) : null);
        });
        toolbar.add(userSelector);
        add(toolbar, BorderLayout.NORTH);

        add(boardView, BorderLayout.CENTER);

        JPanel statusBar = new JPanel(new FlowLayout(FlowLayout.LEFT, 20, 2));
        statusBar.add(statusLabel);
        add(statusBar, BorderLayout.SOUTH);
    }

    private void loadProjects() {
        List<ProjectDocument> projects = projectService.findAll();
        SwingUtilities.invokeLater(() -> {
            projectListModel.clear();
            projects.forEach(projectListModel::addElement);
        });
    }

    private void loadUsers() {
        List<UserDocument> users = userService.findAll();
        SwingUtilities.invokeLater(() -> {
            userSelector.removeAllItems();
            users.forEach(userSelector::addItem);
        });
    }

    private void selectProject(ProjectDocument project) {
        boardView.setProjectId(project.getProjectId());
        statusLabel.setText("Project: " + project.getName());
    }
}
