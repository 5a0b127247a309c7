package com.quickfs.relay.session;

import java.util.List;
import java.util.Map;

/**
 * Description of the advertised file, supplied by the host when the session is created
 * and sent unchanged to every receiver as the {@code file_metadata} payload.
 */
public record FileMetadata(String filename, String filetype, long filesize) {

    public static final String PARAM_FILENAME = "filename";
    public static final String PARAM_FILETYPE = "filetype";
    public static final String PARAM_FILESIZE = "filesize";

    public FileMetadata {
        if (filename == null || filename.isEmpty()) {
            throw new IllegalArgumentException("filename must not be empty");
        }
        if (filetype == null || filetype.isEmpty()) {
            throw new IllegalArgumentException("filetype must not be empty");
        }
        if (filesize < 0) {
            throw new IllegalArgumentException("filesize must not be negative: " + filesize);
        }
    }

    /**
     * Parse metadata from decoded query parameters.
     *
     * @throws InvalidRequestException if a parameter is missing or filesize is not a non-negative integer
     */
    public static FileMetadata fromQuery(Map<String, List<String>> params) throws InvalidRequestException {
        String filename = first(params, PARAM_FILENAME);
        String filetype = first(params, PARAM_FILETYPE);
        String filesize = first(params, PARAM_FILESIZE);

        if (filename.isEmpty() || filetype.isEmpty() || filesize.isEmpty()) {
            throw new InvalidRequestException("Missing required query parameters: filename, filetype, filesize");
        }

        long size;
        try {
            size = Long.parseLong(filesize);
        } catch (NumberFormatException e) {
            throw new InvalidRequestException("Invalid filesize parameter", e);
        }
        if (size < 0) {
            throw new InvalidRequestException("Invalid filesize parameter");
        }
        return new FileMetadata(filename, filetype, size);
    }

    private static String first(Map<String, List<String>> params, String name) {
        List<String> values = params.get(name);
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return "";
        }
        return values.get(0);
    }
}
