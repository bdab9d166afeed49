package io.github.yok.flashsync.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flashsync.db.SourceConnectionFactory;
import io.github.yok.flashsync.db.SourceHandle;
import io.github.yok.flashsync.error.ConnectionException;
import io.github.yok.flashsync.error.SchemaInferenceException;
import io.github.yok.flashsync.model.DestinationTableSpec;
import io.github.yok.flashsync.model.ExtractionJob;
import io.github.yok.flashsync.model.InferredSchema;
import io.github.yok.flashsync.model.SchemaField;
import io.github.yok.flashsync.model.SemanticType;
import io.github.yok.flashsync.model.SourceDatabase;
import io.github.yok.flashsync.model.SyncOutcome;
import io.github.yok.flashsync.model.SyncTask;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.slf4j.MDC;

class TableSyncWorkerTest {

    private final SourceDatabase source = SourceDatabase.builder().name("salesforce")
            .url("jdbc:mysql://h/salesforce_db").user("u").password("p")
            .databaseName("salesforce_db").table("arr_sf_account").build();
    private final SyncTask task = new SyncTask(source, "arr_sf_account");
    private final InferredSchema schema =
            InferredSchema.of(SchemaField.required("id", SemanticType.INTEGER));

    private SourceConnectionFactory connectionFactory;
    private SourceHandle handle;
    private Connection connection;
    private SchemaInferencer inferencer;
    private TableReconciler reconciler;
    private ExtractLoadExecutor executor;
    private TableSyncWorker worker;
    private RunContext context;

    @BeforeEach
    void setup() throws Exception {
        connectionFactory = mock(SourceConnectionFactory.class);
        handle = mock(SourceHandle.class);
        connection = mock(Connection.class);
        inferencer = mock(SchemaInferencer.class);
        reconciler = mock(TableReconciler.class);
        executor = mock(ExtractLoadExecutor.class);
        when(connectionFactory.open(source, "sync-arr_sf_account")).thenReturn(handle);
        when(handle.getConnection()).thenReturn(connection);
        worker = new TableSyncWorker(connectionFactory, inferencer, reconciler, executor);
        context = new RunContext(Duration.ofMinutes(1));
    }

    @Test
    void sync_正常ケース_推論と調整と抽出ロードが順に実行されること() throws Exception {
        when(inferencer.infer(connection, task.sampleQuery(), context)).thenReturn(schema);
        when(reconciler.reconcile(any())).thenReturn(TableReconciler.Action.CREATED);
        SyncOutcome expected = SyncOutcome.builder().task(task)
                .status(SyncOutcome.Status.SUCCEEDED).rowsExtracted(5).loaded(true).build();
        when(executor.execute(eq(context), eq(task), eq(connection), any())).thenReturn(expected);

        SyncOutcome outcome = worker.sync(context, task);

        assertEquals(expected, outcome);
        InOrder order = inOrder(inferencer, reconciler, executor, connection, handle);
        order.verify(inferencer).infer(connection,
                "SELECT * FROM salesforce_db.arr_sf_account LIMIT 1", context);
        order.verify(reconciler).reconcile(new DestinationTableSpec("arr_sf_account", schema));
        order.verify(executor).execute(context, task, connection, ExtractionJob.forTask(task));
        order.verify(connection).close();
        order.verify(handle).close();
        assertNull(MDC.get("table"));
        assertNull(MDC.get("source"));
    }

    @Test
    void sync_異常ケース_接続取得に失敗する_ConnectionExceptionが送出されプールが閉じられること()
            throws Exception {
        when(handle.getConnection()).thenThrow(new SQLException("Access denied for user"));

        assertThrows(ConnectionException.class, () -> worker.sync(context, task));

        verify(handle).close();
        verify(inferencer, never()).infer(any(), any(), any());
    }

    @Test
    void sync_異常ケース_推論に失敗する_後続処理が実行されないこと() throws Exception {
        when(inferencer.infer(connection, task.sampleQuery(), context))
                .thenThrow(new SchemaInferenceException("no such table"));

        assertThrows(SchemaInferenceException.class, () -> worker.sync(context, task));

        verify(reconciler, never()).reconcile(any());
        verify(executor, never()).execute(any(), any(), any(), any());
        verify(handle).close();
    }

    @Test
    void sync_異常ケース_プール作成に失敗する_ConnectionExceptionがそのまま送出されること()
            throws Exception {
        when(connectionFactory.open(source, "sync-arr_sf_account"))
                .thenThrow(new ConnectionException("bad url"));

        assertThrows(ConnectionException.class, () -> worker.sync(context, task));
        assertNull(MDC.get("source"));
    }
}
