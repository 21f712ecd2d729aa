package com.acme.nummern.script.runtime;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BoundedStreamCollectorTest {

    @Test
    void shouldKeepEverythingWithinBudget() throws Exception {
        BoundedStreamCollector collector = new BoundedStreamCollector(
            new ByteArrayInputStream("héllo\n".getBytes(StandardCharsets.UTF_8)), 1024, "test-reader");
        collector.start();
        assertTrue(collector.join(5_000));
        assertEquals("héllo\n", collector.text());
        assertEquals(0, collector.droppedBytes());
    }

    @Test
    void shouldDropBytesBeyondBudget() throws Exception {
        byte[] data = new byte[20_000];
        Arrays.fill(data, (byte) 'x');
        BoundedStreamCollector collector = new BoundedStreamCollector(new ByteArrayInputStream(data), 1000, "test-reader");
        collector.start();
        assertTrue(collector.join(5_000));
        assertEquals(1000, collector.text().length());
        assertEquals(19_000, collector.droppedBytes());
    }

    @Test
    void shouldNotEndTruncatedTextWithPartialCharacter() throws Exception {
        // 'a' then the first two of the three bytes of '€'
        byte[] data = "a€€".getBytes(StandardCharsets.UTF_8);
        BoundedStreamCollector collector = new BoundedStreamCollector(new ByteArrayInputStream(data), 3, "test-reader");
        collector.start();
        assertTrue(collector.join(5_000));
        assertEquals("a", collector.text());
        assertEquals(4, collector.droppedBytes());
    }

    @Test
    void shouldMeasureCompleteUtf8Prefix() {
        byte[] data = "aé€".getBytes(StandardCharsets.UTF_8);
        assertEquals(6, BoundedStreamCollector.completeUtf8Length(data));
        assertEquals(3, BoundedStreamCollector.completeUtf8Length(Arrays.copyOf(data, 4)));
        assertEquals(3, BoundedStreamCollector.completeUtf8Length(Arrays.copyOf(data, 5)));
        assertEquals(1, BoundedStreamCollector.completeUtf8Length(Arrays.copyOf(data, 2)));
        assertEquals(0, BoundedStreamCollector.completeUtf8Length(new byte[0]));
    }
}
