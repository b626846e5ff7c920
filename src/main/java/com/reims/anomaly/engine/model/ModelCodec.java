package com.reims.anomaly.engine.model;

import com.reims.anomaly.model.DetectorKind;

import java.io.IOException;

/**
 * Payload encoding for one model kind. The envelope (magic, version, checksum,
 * compression) is added by {@link ModelSerializer}.
 */
public interface ModelCodec<M extends OutlierModel> {

    DetectorKind kind();

    /** Stable one-byte identifier written into the envelope. */
    byte kindCode();

    Class<M> modelClass();

    byte[] encode(M model) throws IOException;

    M decode(byte[] payload) throws IOException;
}
