package io.github.yok.bendload.source;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import com.sun.net.httpserver.HttpServer;
import io.github.yok.bendload.core.LoadErrorKind;
import io.github.yok.bendload.core.LoadException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceReaderTest {

    @TempDir
    Path tempDir;

    private HttpServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    private static List<String> readAll(LineStream stream) throws IOException {
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = stream.nextLine()) != null) {
            lines.add(line);
        }
        return lines;
    }

    private String startServer(int status, String body) throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/data.csv", exchange -> {
            byte[] response = body.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, response.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(response);
            }
        });
        server.start();
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/data.csv";
    }

    @Test
    void open_正常ケース_ローカルファイルを指定する_全行が順に読めること() throws Exception {
        Path file = tempDir.resolve("a.csv");
        Files.writeString(file, "1,a\n2,b\r\n3,c", StandardCharsets.UTF_8);

        try (LineStream stream = new SourceReader().open(SourceSpec.localPath(file.toString()))) {
            assertEquals(List.of("1,a", "2,b", "3,c"), readAll(stream));
            assertEquals(3, stream.getLinesRead());
            assertTrue(stream.isExhausted());
            assertNull(stream.nextLine());
        }
    }

    @Test
    void open_正常ケース_UTF8の日本語を含むファイルを指定する_文字化けせず読めること() throws Exception {
        Path file = tempDir.resolve("jp.csv");
        Files.writeString(file, "1,東京\n", StandardCharsets.UTF_8);

        try (LineStream stream = new SourceReader().open(SourceSpec.localPath(file.toString()))) {
            assertEquals("1,東京", stream.nextLine());
        }
    }

    @Test
    void open_異常ケース_存在しないファイルを指定する_SOURCE_ERRORが送出されること() {
        Path missing = tempDir.resolve("missing.csv");
        LoadException ex = assertThrows(LoadException.class,
                () -> new SourceReader().open(SourceSpec.localPath(missing.toString())));
        assertEquals(LoadErrorKind.SOURCE_ERROR, ex.getKind());
        assertTrue(ex.getMessage().contains("does not exist"));
    }

    @Test
    void open_異常ケース_ディレクトリを指定する_SOURCE_ERRORが送出されること() {
        LoadException ex = assertThrows(LoadException.class,
                () -> new SourceReader().open(SourceSpec.localPath(tempDir.toString())));
        assertEquals(LoadErrorKind.SOURCE_ERROR, ex.getKind());
    }

    @Test
    void open_正常ケース_URLを指定する_レスポンス本文が行単位で読めること() throws Exception {
        String url = startServer(200, "x,1\ny,2\n");

        try (LineStream stream = new SourceReader().open(SourceSpec.remoteUrl(url))) {
            assertEquals(List.of("x,1", "y,2"), readAll(stream));
        }
    }

    @Test
    void open_異常ケース_URLが404を返す_SOURCE_ERRORが送出されること() throws Exception {
        String url = startServer(404, "not found");

        LoadException ex = assertThrows(LoadException.class,
                () -> new SourceReader().open(SourceSpec.remoteUrl(url)));
        assertEquals(LoadErrorKind.SOURCE_ERROR, ex.getKind());
        assertTrue(ex.getMessage().contains("HTTP 404"));
    }

    @Test
    void open_異常ケース_接続できないURLを指定する_SOURCE_ERRORが送出されること() throws Exception {
        String url = startServer(200, "");
        server.stop(0);
        server = null;

        LoadException ex = assertThrows(LoadException.class,
                () -> new SourceReader().open(SourceSpec.remoteUrl(url)));
        assertEquals(LoadErrorKind.SOURCE_ERROR, ex.getKind());
    }

    @Test
    void open_正常ケース_標準入力を指定する_入力が読めて元ストリームは閉じられないこと() throws Exception {
        AtomicBoolean closed = new AtomicBoolean(false);
        InputStream stdin =
                new ByteArrayInputStream("h\n1,a\n".getBytes(StandardCharsets.UTF_8)) {
                    @Override
                    public void close() throws IOException {
                        closed.set(true);
                        super.close();
                    }
                };
        SourceReader reader = new SourceReader(HttpClient.newHttpClient(), () -> stdin);

        try (LineStream stream = reader.open(SourceSpec.stdin())) {
            assertEquals(List.of("h", "1,a"), readAll(stream));
        }
        assertFalse(closed.get());
    }
}
