package com.quickfs.relay.session;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileMetadataTest {

    private static Map<String, List<String>> query(String filename, String filetype, String filesize) {
        Map<String, List<String>> params = new HashMap<>();
        if (filename != null) params.put("filename", List.of(filename));
        if (filetype != null) params.put("filetype", List.of(filetype));
        if (filesize != null) params.put("filesize", List.of(filesize));
        return params;
    }

    @Test
    void parsesValidQuery() throws Exception {
        FileMetadata meta = FileMetadata.fromQuery(query("report.pdf", "application/pdf", "2048"));

        assertEquals("report.pdf", meta.filename());
        assertEquals("application/pdf", meta.filetype());
        assertEquals(2048L, meta.filesize());
    }

    @Test
    void zeroByteFileAccepted() throws Exception {
        assertEquals(0L, FileMetadata.fromQuery(query("empty.txt", "text/plain", "0")).filesize());
    }

    @Test
    void missingParameterRejected() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> FileMetadata.fromQuery(query("report.pdf", null, "2048")));
        assertTrue(e.getMessage().contains("Missing required query parameters"));

        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(query(null, "a/b", "1")));
        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(query("x", "a/b", null)));
        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(Map.of()));
    }

    @Test
    void emptyParameterRejected() {
        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(query("", "a/b", "1")));
    }

    @Test
    void unparsableSizeRejected() {
        InvalidRequestException e = assertThrows(InvalidRequestException.class,
                () -> FileMetadata.fromQuery(query("x", "a/b", "12kb")));
        assertEquals("Invalid filesize parameter", e.getMessage());

        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(query("x", "a/b", "1.5")));
        assertThrows(InvalidRequestException.class,
                () -> FileMetadata.fromQuery(query("x", "a/b", "99999999999999999999")));
    }

    @Test
    void negativeSizeRejected() {
        assertThrows(InvalidRequestException.class, () -> FileMetadata.fromQuery(query("x", "a/b", "-1")));
    }
}
