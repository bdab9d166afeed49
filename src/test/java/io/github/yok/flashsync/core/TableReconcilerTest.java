package io.github.yok.flashsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flashsync.destination.DestinationClient;
import io.github.yok.flashsync.destination.DestinationException;
import io.github.yok.flashsync.destination.SchemaUpdateException;
import io.github.yok.flashsync.destination.TableState;
import io.github.yok.flashsync.error.ReconciliationException;
import io.github.yok.flashsync.model.DestinationTableSpec;
import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SchemaField;
import io.github.yok.flashsync.model.SemanticType;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class TableReconcilerTest {

    private final InferredSchema schema =
            InferredSchema.of(SchemaField.required("id", SemanticType.INTEGER),
                    SchemaField.nullable("name", SemanticType.STRING));
    private final DestinationTableSpec spec = new DestinationTableSpec("t1", schema);

    private DestinationClient destination;
    private TableReconciler reconciler;

    @BeforeEach
    void setup() {
        destination = mock(DestinationClient.class);
        reconciler = new TableReconciler(destination);
    }

    @Test
    void reconcile_正常ケース_テーブルが存在しない_作成されること() throws Exception {
        when(destination.describeTable("t1")).thenReturn(Optional.empty());

        assertEquals(TableReconciler.Action.CREATED, reconciler.reconcile(spec));

        verify(destination).createTable(spec);
        verify(destination, never()).updateSchema(any());
    }

    @Test
    void reconcile_正常ケース_スキーマが等しい_何もしないこと_2回目も同じであること() throws Exception {
        InferredSchema reordered =
                InferredSchema.of(SchemaField.nullable("name", SemanticType.STRING),
                        SchemaField.nullable("id", SemanticType.INTEGER));
        when(destination.describeTable("t1"))
                .thenReturn(Optional.of(new TableState("t1", reordered)));

        assertEquals(TableReconciler.Action.UNCHANGED, reconciler.reconcile(spec));
        assertEquals(TableReconciler.Action.UNCHANGED, reconciler.reconcile(spec));

        verify(destination, never()).createTable(any());
        verify(destination, never()).updateSchema(any());
        verify(destination, never()).deleteTable(anyString());
    }

    @Test
    void reconcile_正常ケース_列追加_インプレース更新されること() throws Exception {
        when(destination.describeTable("t1")).thenReturn(Optional.of(new TableState("t1",
                InferredSchema.of(SchemaField.required("id", SemanticType.INTEGER)))));

        assertEquals(TableReconciler.Action.UPDATED, reconciler.reconcile(spec));

        verify(destination).updateSchema(spec);
        verify(destination, never()).deleteTable(anyString());
    }

    @Test
    void reconcile_正常ケース_破壊的変更で更新拒否_削除後に再作成されること() throws Exception {
        when(destination.describeTable("t1")).thenReturn(Optional.of(new TableState("t1",
                InferredSchema.of(SchemaField.required("id", SemanticType.STRING),
                        SchemaField.nullable("name", SemanticType.STRING)))));
        doThrow(new SchemaUpdateException("refused", new RuntimeException("changed type"), true))
                .when(destination).updateSchema(spec);

        assertEquals(TableReconciler.Action.RECREATED, reconciler.reconcile(spec));

        InOrder order = inOrder(destination);
        order.verify(destination).updateSchema(spec);
        order.verify(destination).deleteTable("t1");
        order.verify(destination).createTable(spec);
    }

    @Test
    void reconcile_異常ケース_破壊的でない更新失敗_ReconciliationExceptionが送出され削除されないこと()
            throws Exception {
        when(destination.describeTable("t1")).thenReturn(Optional.of(new TableState("t1",
                InferredSchema.of(SchemaField.required("id", SemanticType.INTEGER)))));
        doThrow(new SchemaUpdateException("quota", new RuntimeException("rateLimitExceeded"),
                false)).when(destination).updateSchema(spec);

        assertThrows(ReconciliationException.class, () -> reconciler.reconcile(spec));

        verify(destination, never()).deleteTable(anyString());
        verify(destination, never()).createTable(any());
    }

    @Test
    void reconcile_異常ケース_再作成に失敗する_ReconciliationExceptionが送出されること()
            throws Exception {
        when(destination.describeTable("t1")).thenReturn(Optional.of(new TableState("t1",
                InferredSchema.of(SchemaField.required("id", SemanticType.STRING)))));
        doThrow(new SchemaUpdateException("refused", null, true)).when(destination)
                .updateSchema(spec);
        doThrow(new DestinationException("create failed")).when(destination).createTable(spec);

        assertThrows(ReconciliationException.class, () -> reconciler.reconcile(spec));
        verify(destination).deleteTable("t1");
    }

    @Test
    void reconcile_異常ケース_テーブル情報の取得に失敗する_ReconciliationExceptionが送出されること()
            throws Exception {
        when(destination.describeTable("t1")).thenThrow(new DestinationException("denied"));
        assertThrows(ReconciliationException.class, () -> reconciler.reconcile(spec));
    }
}
