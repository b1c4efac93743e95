package io.github.yok.bendload.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.bendload.source.LineStream;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class BatcherTest {

    private static LineStream lines(List<String> lines) {
        return new LineStream(new StringReader(String.join("\n", lines)), "test");
    }

    private static List<Batch> drain(Batcher batcher) throws Exception {
        List<Batch> batches = new ArrayList<>();
        Batch batch;
        while ((batch = batcher.next()) != null) {
            batches.add(batch);
        }
        return batches;
    }

    private static List<String> numbered(int count) {
        return IntStream.rangeClosed(1, count).mapToObj(i -> i + ",v" + i)
                .collect(Collectors.toList());
    }

    @Test
    void next_正常ケース_行数がバッチサイズで割り切れない_切り上げ件数のバッチになること() throws Exception {
        for (int size = 1; size <= 7; size++) {
            for (int count = 0; count <= 20; count++) {
                Batcher batcher = new Batcher(lines(numbered(count)), size);
                List<Batch> batches = drain(batcher);
                assertEquals((count + size - 1) / size, batches.size(),
                        "size=" + size + ", count=" + count);
                assertEquals(count, batches.stream().mapToInt(Batch::size).sum());
            }
        }
    }

    @Test
    void next_正常ケース_複数バッチに分割する_バッチ間の順序と連番が保たれること() throws Exception {
        Batcher batcher = new Batcher(lines(numbered(5)), 2);
        List<Batch> batches = drain(batcher);

        assertEquals(3, batches.size());
        assertEquals(List.of("1,v1", "2,v2"), batches.get(0).getLines());
        assertEquals(List.of("3,v3", "4,v4"), batches.get(1).getLines());
        assertEquals(List.of("5,v5"), batches.get(2).getLines());
        assertEquals(List.of(1, 2, 3),
                batches.stream().map(Batch::getIndex).collect(Collectors.toList()));
        assertEquals(3, batcher.getBatchCount());
    }

    @Test
    void next_正常ケース_空白のみのチャンクを含む_そのチャンクが除外されること() throws Exception {
        List<String> source = List.of("1,a", "2,b", "  ", "\t", "3,c");
        Batcher batcher = new Batcher(lines(source), 2);
        List<Batch> batches = drain(batcher);

        assertEquals(2, batches.size());
        assertEquals(List.of("1,a", "2,b"), batches.get(0).getLines());
        assertEquals(List.of("3,c"), batches.get(1).getLines());
        assertEquals(2, batches.get(1).getIndex());
        assertEquals(1, batcher.getDroppedCount());
    }

    @Test
    void next_正常ケース_全行が空白である_バッチが返らないこと() throws Exception {
        Batcher batcher = new Batcher(lines(List.of("", " ", "")), 10);

        assertNull(batcher.next());
        assertEquals(0, batcher.getBatchCount());
        assertEquals(1, batcher.getDroppedCount());
    }

    @Test
    void next_正常ケース_空白行と値行が混在する_空白行もバッチに残ること() throws Exception {
        Batcher batcher = new Batcher(lines(List.of("", "1,a", " ")), 10);

        Batch batch = batcher.next();
        assertEquals(3, batch.size());
        assertNull(batcher.next());
    }

    @Test
    void コンストラクタ_異常ケース_バッチサイズ0を指定する_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class, () -> new Batcher(lines(List.of()), 0));
    }
}
