package com.netflowradar.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

import java.math.BigInteger;

/**
 * Writes BigInteger amounts as base-10 strings so no precision is lost.
 */
@WritingConverter
public class BigIntegerToStringConverter implements Converter<BigInteger, String> {

    @Override
    public String convert(BigInteger source) {
        return source == null ? null : source.toString();
    }
}
