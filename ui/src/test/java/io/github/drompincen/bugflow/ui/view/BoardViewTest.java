package io.github.drompincen.bugflow.ui.view;

import io.github.drompincen.bugflow.persistence.stream.ChangeStreamService;
import io.github.drompincen.bugflow.protocol.api.BugStatus;
import io.github.drompincen.bugflow.ui.board.BoardGateway;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class BoardViewTest {

    @Mock
    private BoardGateway gateway;
    @Mock
    private ChangeStreamService changeStreamService;

    @Test
    void constructsOneColumnPerStatus() {
        BoardView view = new BoardView(gateway, changeStreamService);
        assertThat(view.getComponentCount()).isEqualTo(BugStatus.values().length);
        assertThat(view.reconciler()).isNotNull();
    }
}
