package io.decaylite.engine.dto;

import java.util.List;

public class JsonConfig {
    public List<String> authorizedCallers;
    public List<JsonPool> pools;
}
