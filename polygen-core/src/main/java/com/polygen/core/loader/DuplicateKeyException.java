package com.polygen.core.loader;

/**
 * Two source files contribute rows with the same primary-key value.
 *
 * <p>Loading fails as a whole; neither row is kept.
 */
public class DuplicateKeyException extends DataLoadException {

    private final String key;
    private final String firstFile;
    private final String secondFile;

    public DuplicateKeyException(String key, String firstFile, String secondFile) {
        super("Duplicate key '" + key + "' found in files: '" + firstFile + "' and '" + secondFile + "'");
        this.key = key;
        this.firstFile = firstFile;
        this.secondFile = secondFile;
    }

    public String getKey() {
        return key;
    }

    public String getFirstFile() {
        return firstFile;
    }

    public String getSecondFile() {
        return secondFile;
    }
}
