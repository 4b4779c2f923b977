package com.imageanalysis.query;

import com.imageanalysis.shared.model.ResultStatus;
import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Accepts {@code status=partial} as well as {@code status=PARTIAL}.
 */
@Component
public class ResultStatusConverter implements Converter<String, ResultStatus> {

    @Override
    public ResultStatus convert(String source) {
        return ResultStatus.valueOf(source.trim().toUpperCase(Locale.ROOT));
    }
}
