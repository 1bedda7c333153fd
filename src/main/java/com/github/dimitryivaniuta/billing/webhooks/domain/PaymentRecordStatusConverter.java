package com.github.dimitryivaniuta.billing.webhooks.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class PaymentRecordStatusConverter implements AttributeConverter<PaymentRecordStatus, String> {

    @Override
    public String convertToDatabaseColumn(PaymentRecordStatus attribute) {
        return attribute == null ? null : attribute.dbValue();
    }

    @Override
    public PaymentRecordStatus convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PaymentRecordStatus.fromDb(dbData);
    }
}
