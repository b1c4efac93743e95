package io.github.yok.bendload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.bendload.client.QueryEndpointClient;
import io.github.yok.bendload.client.QueryExecutionException;
import io.github.yok.bendload.client.QueryResult;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemaResolverTest {

    private static final String SHOW_T = "SHOW TABLES LIKE 't';";

    private QueryEndpointClient client;

    private SchemaResolver resolver;

    @BeforeEach
    void setup() {
        client = mock(QueryEndpointClient.class);
        resolver = new SchemaResolver(client, "Fuse");
    }

    private static QueryResult found() {
        return new QueryResult("q1", List.of("name"), List.of(List.of("t")));
    }

    private static QueryResult notFound() {
        return new QueryResult("q1", List.of("name"), List.of());
    }

    @Test
    void resolve_正常ケース_スキーマなしでテーブルが存在する_テーブル名が返ること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(found());

        assertEquals("t", resolver.resolve("t", null));
        verify(client, times(1)).execute(anyString());
    }

    @Test
    void resolve_異常ケース_スキーマなしでテーブルが存在しない_TABLE_NOT_FOUNDが送出されること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(notFound());

        LoadException ex = assertThrows(LoadException.class, () -> resolver.resolve("t", null));
        assertEquals(LoadErrorKind.TABLE_NOT_FOUND, ex.getKind());
        assertEquals("table t not found", ex.getMessage());
    }

    @Test
    void resolve_異常ケース_結果の列や行がnullである_TABLE_NOT_FOUNDが送出されること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(new QueryResult(null, null, List.of(List.of("t"))))
                .thenReturn(new QueryResult(null, List.of("name"), null));

        assertEquals(LoadErrorKind.TABLE_NOT_FOUND,
                assertThrows(LoadException.class, () -> resolver.resolve("t", null)).getKind());
        assertEquals(LoadErrorKind.TABLE_NOT_FOUND,
                assertThrows(LoadException.class, () -> resolver.resolve("t", null)).getKind());
    }

    @Test
    void resolve_正常ケース_スキーマありでテーブルが存在する_スキーマは無視されテーブル名が返ること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(found());

        assertEquals("t", resolver.resolve("t", TableSchema.parse("a:uint8,b:uint64")));
        verify(client, never()).execute("CREATE TABLE t(a uint8, b uint64) Engine = Fuse;");
    }

    @Test
    void resolve_正常ケース_スキーマありでテーブルが存在しない_作成文が発行され列付き参照が返ること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(notFound());

        String ref = resolver.resolve("t", TableSchema.parse("a:uint8,b:uint64"));

        assertEquals("t (a, b)", ref);
        verify(client).execute("CREATE TABLE t(a uint8, b uint64) Engine = Fuse;");
    }

    @Test
    void resolve_異常ケース_作成文が失敗する_ENDPOINT_ERRORが送出されること() throws Exception {
        QueryExecutionException cause = new QueryExecutionException("syntax error");
        when(client.execute(SHOW_T)).thenReturn(notFound());
        when(client.execute("CREATE TABLE t(a uint8) Engine = Fuse;")).thenThrow(cause);

        LoadException ex = assertThrows(LoadException.class,
                () -> resolver.resolve("t", TableSchema.parse("a:uint8")));
        assertEquals(LoadErrorKind.ENDPOINT_ERROR, ex.getKind());
        assertSame(cause, ex.getCause());
    }

    @Test
    void tableExists_異常ケース_存在確認が失敗する_ENDPOINT_ERRORが送出されること() throws Exception {
        when(client.execute(SHOW_T)).thenThrow(new QueryExecutionException("connection refused"));

        LoadException ex = assertThrows(LoadException.class, () -> resolver.tableExists("t"));
        assertEquals(LoadErrorKind.ENDPOINT_ERROR, ex.getKind());
        assertTrue(ex.getMessage().contains("connection refused"));
    }

    @Test
    void tableExists_正常ケース_同じ状態で2回確認する_同じ判定が返ること() throws Exception {
        when(client.execute(SHOW_T)).thenReturn(found());
        assertTrue(resolver.tableExists("t"));
        assertTrue(resolver.tableExists("t"));

        when(client.execute("SHOW TABLES LIKE 'u';")).thenReturn(notFound());
        assertFalse(resolver.tableExists("u"));
        assertFalse(resolver.tableExists("u"));
    }

    @Test
    void createTableStatement_正常ケース_エンジンを指定する_指定エンジンで生成されること() {
        assertEquals("CREATE TABLE t(a uint8) Engine = Memory;",
                SchemaResolver.createTableStatement("t", TableSchema.parse("a:uint8"), "Memory"));
    }
}
