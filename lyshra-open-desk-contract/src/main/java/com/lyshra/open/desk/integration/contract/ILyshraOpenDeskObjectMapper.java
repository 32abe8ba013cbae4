package com.lyshra.open.desk.integration.contract;

import java.io.InputStream;

public interface ILyshraOpenDeskObjectMapper {
    <T> T convertValue(Object fromValue, Class<T> toValueType) throws IllegalArgumentException;
    <T> T readValue(InputStream source, Class<T> valueType);
}
