package com.reims.anomaly.engine.isolationforest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.reims.anomaly.engine.model.ModelCodec;
import com.reims.anomaly.model.DetectorKind;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class IsolationForestCodec implements ModelCodec<IsolationForest> {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Override
    public DetectorKind kind() {
        return DetectorKind.ISOLATION_FOREST;
    }

    @Override
    public byte kindCode() {
        return 1;
    }

    @Override
    public Class<IsolationForest> modelClass() {
        return IsolationForest.class;
    }

    @Override
    public byte[] encode(IsolationForest model) throws IOException {
        return objectMapper.writeValueAsBytes(model);
    }

    @Override
    public IsolationForest decode(byte[] payload) throws IOException {
        return objectMapper.readValue(payload, IsolationForest.class);
    }
}
