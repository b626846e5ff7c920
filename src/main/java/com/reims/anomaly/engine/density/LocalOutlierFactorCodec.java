package com.reims.anomaly.engine.density;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reims.anomaly.engine.model.ModelCodec;
import com.reims.anomaly.model.DetectorKind;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class LocalOutlierFactorCodec implements ModelCodec<LocalOutlierFactor> {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public DetectorKind kind() {
        return DetectorKind.LOCAL_OUTLIER_FACTOR;
    }

    @Override
    public byte kindCode() {
        return 2;
    }

    @Override
    public Class<LocalOutlierFactor> modelClass() {
        return LocalOutlierFactor.class;
    }

    @Override
    public byte[] encode(LocalOutlierFactor model) throws IOException {
        return objectMapper.writeValueAsBytes(model);
    }

    @Override
    public LocalOutlierFactor decode(byte[] payload) throws IOException {
        return objectMapper.readValue(payload, LocalOutlierFactor.class);
    }
}
