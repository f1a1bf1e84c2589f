package io.github.drompincen.bugflow.ui.view;

import io.github.drompincen.bugflow.persistence.stream.ChangeStreamService;
import io.github.drompincen.bugflow.protocol.api.BugDto;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.runtime.policy.Actor;
import io.github.drompincen.bugflow.ui.board.BoardGateway;
import io.github.drompincen.bugflow.ui.board.BoardListener;
import io.github.drompincen.bugflow.ui.board.BoardReconciler;
import io.github.drompincen.bugflow.ui.board.DropTarget;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;

import javax.swing.*;
import java.awt.*;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.Transferable;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Kanban board with one column per status. Drag a card to another column, or
 * onto a card in it, to change status. Engine calls run on a background thread.
 */
@Component
public class BoardView extends JPanel implements BoardListener {

    private static final Logger log = LoggerFactory.getLogger(BoardView.class);

    private final ChangeStreamService changeStreamService;
    private final BoardReconciler reconciler;
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "board-worker");
        t.setDaemon(true);
        return t;
    });
    private final Map<BugStatus, JPanel> columns = new EnumMap<>(BugStatus.class);

    private volatile Actor actor;
    private Disposable activityWatch;

    public BoardView(BoardGateway gateway, ChangeStreamService changeStreamService) {
        this.changeStreamService = changeStreamService;
        this.reconciler = new BoardReconciler(gateway, this);

        setLayout(new GridLayout(1, 0, 8, 0));
        setBorder(BorderFactory.createEmptyBorder(8, 8, 8, 8));

        for (BugStatus status : BugStatus.values()) {
            JPanel column = createColumn(status);
            columns.put(status, column);
            add(column);
        }
    }

    private JPanel createColumn(BugStatus status) {
        JPanel column = new JPanel();
        column.setLayout(new BoxLayout(column, BoxLayout.Y_AXIS));
        column.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createLineBorder(borderColor(), 1),
                BorderFactory.createEmptyBorder(8, 8, 8, 8)));
        column.setTransferHandler(new CardDropHandler(DropTarget.column(status)));
        addHeader(column, status);
        return column;
    }

    private static Color borderColor() {
        Color color = UIManager.getColor("Component.borderColor");
        return color != null ? color : Color.GRAY;
    }

    private static void addHeader(JPanel column, BugStatus status) {
        JLabel header = new JLabel(status.label());
        header.setFont(header.getFont().deriveFont(Font.BOLD));
        header.setAlignmentX(LEFT_ALIGNMENT);
        column.add(header);
        column.add(Box.createVerticalStrut(8));
    }

    public void setActor(Actor actor) {
        this.actor = actor;
    }

    public void setProjectId(String projectId) {
        if (activityWatch != null) {
            activityWatch.dispose();
        }
        runInBackground(() -> reconciler.load(projectId));
        activityWatch = changeStreamService.watchActivities()
                .subscribe(activity -> runInBackground(reconciler::refresh),
                        e -> log.warn("Activity watch ended: {}", e.getMessage()));
    }

    BoardReconciler reconciler() {
        return reconciler;
    }

    @Override
    public void cardsChanged(List<BugDto> cards) {
        SwingUtilities.invokeLater(() -> render(cards));
    }

    @Override
    public void validationRequired(BugDto bug) {
        SwingUtilities.invokeLater(() -> {
            int choice = JOptionPane.showConfirmDialog(this,
                    "\"" + bug.title() + "\" must be validated before it can be closed.\nValidate and close it now?",
                    "Validation required", JOptionPane.YES_NO_OPTION, JOptionPane.QUESTION_MESSAGE);
            Actor current = actor;
            if (choice == JOptionPane.YES_OPTION && current != null) {
                runInBackground(() -> reconciler.confirmValidation(current));
            } else {
                runInBackground(reconciler::cancelValidation);
            }
        });
    }

    @Override
    public void errorReported(String message) {
        SwingUtilities.invokeLater(() ->
                JOptionPane.showMessageDialog(this, message, "Change rejected", JOptionPane.WARNING_MESSAGE));
    }

    private void render(List<BugDto> cards) {
        for (Map.Entry<BugStatus, JPanel> entry : columns.entrySet()) {
            JPanel column = entry.getValue();
            column.removeAll();
            addHeader(column, entry.getKey());
            cards.stream()
                    .filter(b -> b.status() == entry.getKey())
                    .forEach(b -> {
                        column.add(createCard(b));
                        column.add(Box.createVerticalStrut(4));
                    });
            column.add(Box.createVerticalGlue());
        }
        revalidate();
        repaint();
    }

    private JLabel createCard(BugDto bug) {
        String text = "<html><b>" + escape(bug.title()) + "</b><br/>" + bug.priority().label()
                + (bug.validated() ? " &middot; validated" : "") + "</html>";
        JLabel card = new JLabel(text);
        card.setAlignmentX(LEFT_ALIGNMENT);
        card.setMaximumSize(new Dimension(Integer.MAX_VALUE, 56));
        card.setBorder(BorderFactory.createCompoundBorder(
                BorderFactory.createMatteBorder(0, 3, 0, 0, new Color(0x00, 0x7A, 0xCC)),
                BorderFactory.createEmptyBorder(6, 8, 6, 8)));
        card.setTransferHandler(new CardDropHandler(DropTarget.card(bug.id())));
        card.putClientProperty("bugId", bug.id());
        card.addMouseListener(new MouseAdapter() {
            @Override
            public void mousePressed(MouseEvent e) {
                if (reconciler.startDrag(bug.id())) {
                    card.getTransferHandler().exportAsDrag(card, e, TransferHandler.MOVE);
                }
            }
        });
        return card;
    }

    private static String escape(String text) {
        return text == null ? "" : text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private void runInBackground(Runnable task) {
        worker.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Board update failed", e);
                errorReported("Board update failed: " + e.getMessage());
            }
        });
    }

    @PreDestroy
    void shutdown() {
        if (activityWatch != null) {
            activityWatch.dispose();
        }
        worker.shutdownNow();
    }

    /** Exports the dragged card's id; imports by handing the drop to the reconciler. */
    private class CardDropHandler extends TransferHandler {

        private final DropTarget target;

        CardDropHandler(DropTarget target) {
            this.target = target;
        }

        @Override
        public int getSourceActions(JComponent c) {
            return MOVE;
        }

        @Override
        protected Transferable createTransferable(JComponent c) {
            return new StringSelection(String.valueOf(c.getClientProperty("bugId")));
        }

        @Override
        protected void exportDone(JComponent source, Transferable data, int action) {
            if (action == NONE) {
                runInBackground(reconciler::cancelDrag);
            }
        }

        @Override
        public boolean canImport(TransferSupport support) {
            return support.isDataFlavorSupported(DataFlavor.stringFlavor);
        }

        @Override
        public boolean importData(TransferSupport support) {
            Actor current = actor;
            if (current == null) {
                errorReported("Select a user before moving cards");
                runInBackground(reconciler::cancelDrag);
                return false;
            }
            runInBackground(() -> reconciler.drop(target, current));
            return true;
        }
    }
}
