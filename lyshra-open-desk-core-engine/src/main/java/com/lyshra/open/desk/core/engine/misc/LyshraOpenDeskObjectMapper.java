package com.lyshra.open.desk.core.engine.misc;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskObjectMapper;
import tools.jackson.databind.ObjectMapper;

import java.io.InputStream;

public class LyshraOpenDeskObjectMapper implements ILyshraOpenDeskObjectMapper {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private LyshraOpenDeskObjectMapper() {}

    @Override
    public <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException {
        return objectMapper.convertValue(fromValue, toValueType);
    }

    @Override
    public <T> T readValue(InputStream source, Class<T> valueType) {
        return objectMapper.readValue(source, valueType);
    }

    private static final class SingletonHolder {
        private static final LyshraOpenDeskObjectMapper INSTANCE = new LyshraOpenDeskObjectMapper();
    }

    public static ILyshraOpenDeskObjectMapper getInstance() {
        return SingletonHolder.INSTANCE;
    }
}
