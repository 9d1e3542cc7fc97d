package org.dxworks.dacframe.model;

/**
 * A result record the App writes as one JSON line of its output.
 */
public interface Analysis {
    String getFilePath();
    String getLanguage();
}
