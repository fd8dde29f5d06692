package com.nevis.pdfscan.controller;

import com.nevis.pdfscan.model.FindingType;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

/**
 * Binds {@code finding_type=ssn} style query parameters to {@link FindingType}.
 */
@Component
public class FindingTypeConverter implements Converter<String, FindingType> {

    @Override
    public FindingType convert(String source) {
        return FindingType.fromValue(source.trim());
    }
}
