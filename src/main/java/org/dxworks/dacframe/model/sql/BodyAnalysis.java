package org.dxworks.dacframe.model.sql;

import org.dxworks.dacframe.model.Analysis;

import java.util.ArrayList;
import java.util.List;

public class BodyAnalysis implements Analysis {
    public String kind = "object";
    public String filePath;
    public String language = "sql";
    public String schema;
    public String name;
    public ObjectKind objectKind;
    public List<BodyDependency> dependencies = new ArrayList<>();
    public List<String> references = new ArrayList<>();  // rendered form of dependencies, same order
    public List<String> diagnostics = new ArrayList<>();

    @Override
    public String getFilePath() {
        return filePath;
    }

    @Override
    public String getLanguage() {
        return language;
    }
}
