package com.quicklook.server.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class OperatorMessageLogTest {

    @Test
    public void testMostRecentFirstAndBounded() {
        OperatorMessageLog log = new OperatorMessageLog();
        for (int i = 0; i < OperatorMessageLog.CAPACITY + 5; i++) {
            log.info("m" + i);
        }
        List<OperatorMessageLog.Message> all = log.recent(1000);
        assertEquals(OperatorMessageLog.CAPACITY, all.size());
        assertEquals("m" + (OperatorMessageLog.CAPACITY + 4), all.get(0).text);
        assertEquals("INFO", all.get(0).level);
        assertEquals(3, log.recent(3).size());
    }
}
