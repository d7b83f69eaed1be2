package de.anton.battery.analyser.cycle_analyzer.model;

/**
 * Test protocol of a channel, identified by a token in the workbook file name.
 */
public enum TestMode {
    RATE_1C("-1C-"),
    LOW_RATE_0P1C("-0.1C-"),
    BASELINE("-BL-"),
    OTHER("");

    /** Tokens in the order they are searched for in a file name. */
    private static final String[] SEARCH_ORDER = {"-0.1C-", "-0.5C-", "-1C-", "-BL-", "-0.33C-"};

    private final String fileNameToken;

    TestMode(String fileNameToken) {
        this.fileNameToken = fileNameToken;
    }

    public String getFileNameToken() {
        return fileNameToken;
    }

    /**
     * Finds the first known mode token in the file name. Names without any token default to {@link #RATE_1C}.
     *
     * @param fileName The workbook file name (not the full path).
     * @return The matching TestMode, never null.
     */
    public static TestMode fromFileName(String fileName) {
        if (fileName == null) {
            return RATE_1C;
        }
        for (String token : SEARCH_ORDER) {
            if (fileName.contains(token)) {
                return fromToken(token);
            }
        }
        return RATE_1C;
    }

    /** Maps a raw token such as "-0.5C-" to its mode; unknown tokens are OTHER. */
    public static TestMode fromToken(String token) {
        if (token == null) {
            return OTHER;
        }
        for (TestMode mode : values()) {
            if (!mode.fileNameToken.isEmpty() && mode.fileNameToken.equalsIgnoreCase(token.trim())) {
                return mode;
            }
        }
        return OTHER;
    }
}
