package com.drawdownwatch.monitor.infrastructure.db;

import com.drawdownwatch.common.market.Timeframe;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** Stores timeframes by their short code ({@code 1d}, {@code 1w}, ...). */
@Converter(autoApply = true)
public class TimeframeConverter implements AttributeConverter<Timeframe, String> {

    @Override
    public String convertToDatabaseColumn(Timeframe timeframe) {
        return timeframe == null ? null : timeframe.code();
    }

    @Override
    public Timeframe convertToEntityAttribute(String code) {
        return code == null ? null : Timeframe.fromCode(code);
    }
}
