package com.netflowradar.config;

import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

import java.math.BigInteger;

/**
 * Reads base-10 amount strings back as BigInteger.
 */
@ReadingConverter
public class StringToBigIntegerConverter implements Converter<String, BigInteger> {

    @Override
    public BigInteger convert(String source) {
        return source == null || source.isEmpty() ? null : new BigInteger(source);
    }
}
