package com.architecture.dotspace.service.diagram.layout;

import com.architecture.dotspace.model.diagram.MessageKind;
import com.architecture.dotspace.model.diagram.NodeType;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppearanceCatalogTest {

    @Test
    void coversEveryNodeType() {
        assertThat(AppearanceCatalog.nodeAppearances()).containsKeys(NodeType.values());
        assertThat(AppearanceCatalog.forType(NodeType.USER).getShape()).isEqualTo(NodeShape.CAPSULE);
        assertThat(AppearanceCatalog.forType(null)).isEqualTo(AppearanceCatalog.DEFAULT_NODE);
    }

    @Test
    void isImmutable() {
        assertThatThrownBy(() -> AppearanceCatalog.nodeAppearances().put(NodeType.USER, AppearanceCatalog.DEFAULT_NODE))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void mapsMessageKindsToEdgeAppearance() {
        assertThat(AppearanceCatalog.forMessageKind(MessageKind.SYNC).getThickness())
                .isGreaterThan(AppearanceCatalog.forMessageKind(MessageKind.ASYNC).getThickness());
        assertThat(AppearanceCatalog.forMessageKind(MessageKind.RETURN).getThickness())
                .isLessThan(AppearanceCatalog.forMessageKind(MessageKind.ASYNC).getThickness());
        assertThat(AppearanceCatalog.forMessageKind(null)).isEqualTo(AppearanceCatalog.DEFAULT_EDGE);
    }

    @Test
    void rejectsInvalidLayoutSettings() {
        assertThatThrownBy(() -> new LayoutSettings(0.0, 5.0, 1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LayoutSettings(2.0, -1.0, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
