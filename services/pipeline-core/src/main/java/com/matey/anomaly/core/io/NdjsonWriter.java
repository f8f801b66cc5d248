package com.matey.anomaly.core.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintStream;

/**
 * Writes one JSON document per line to a stream (stdout in the pipe between bridge and
 * detector), flushing after every line.
 */
@Slf4j
@RequiredArgsConstructor
public class NdjsonWriter {

    private final ObjectMapper objectMapper;
    private final PrintStream out;

    /**
     * @return false once the underlying stream has failed (e.g. the reader closed the pipe)
     */
    public synchronized boolean write(Object value) {
        String line;
        try {
            line = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Skipping value that cannot be serialized: {}", e.getMessage());
            return !out.checkError();
        }
        out.print(line);
        out.print('\n');
        out.flush();
        return !out.checkError();
    }
}
