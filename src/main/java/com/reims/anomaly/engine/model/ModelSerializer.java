package com.reims.anomaly.engine.model;

import com.reims.anomaly.exception.CacheCorruptionException;
import com.reims.anomaly.model.DetectorKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Binary model format used by the model cache:
 *
 * <pre>
 *   int    magic      0x524D4443 ("RMDC")
 *   byte   version    1
 *   byte   kind code  per codec
 *   long   crc32      of the compressed payload
 *   int    length     of the compressed payload
 *   byte[] payload    gzip of the codec's encoding
 * </pre>
 *
 * Any mismatch on read raises {@link CacheCorruptionException}.
 */
@Component
public class ModelSerializer {

    private static final Logger log = LoggerFactory.getLogger(ModelSerializer.class);

    static final int MAGIC = 0x524D4443;
    static final byte FORMAT_VERSION = 1;

    private final Map<DetectorKind, ModelCodec<?>> codecs = new EnumMap<>(DetectorKind.class);

    public ModelSerializer(List<ModelCodec<?>> codecs) {
        for (ModelCodec<?> codec : codecs) {
            this.codecs.put(codec.kind(), codec);
            log.info("Registered model codec: {} (code {})", codec.kind(), codec.kindCode());
        }
    }

    public boolean supports(DetectorKind kind) {
        return codecs.containsKey(kind);
    }

    public byte[] serialize(OutlierModel model) {
        ModelCodec<?> codec = codecFor(model.kind());
        try {
            byte[] compressed = gzip(encode(codec, model));
            CRC32 crc = new CRC32();
            crc.update(compressed);

            ByteArrayOutputStream bytes = new ByteArrayOutputStream(compressed.length + 18);
            try (DataOutputStream out = new DataOutputStream(bytes)) {
                out.writeInt(MAGIC);
                out.writeByte(FORMAT_VERSION);
                out.writeByte(codec.kindCode());
                out.writeLong(crc.getValue());
                out.writeInt(compressed.length);
                out.write(compressed);
            }
            return bytes.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to serialize " + model.kind() + " model", e);
        }
    }

    /**
     * Typed read for callers that know the model class they stored.
     */
    public <M extends OutlierModel> M deserialize(byte[] data, DetectorKind expected, Class<M> type) {
        OutlierModel model = deserialize(data, expected);
        if (!type.isInstance(model)) {
            throw new CacheCorruptionException(expected.getCode() + " record decodes to "
                    + model.getClass().getSimpleName() + ", not " + type.getSimpleName());
        }
        return type.cast(model);
    }

    /**
     * @param expected the kind the caller looked up; a record of a different kind is corrupt
     */
    public OutlierModel deserialize(byte[] data, DetectorKind expected) {
        if (data == null || data.length < 18) {
            throw new CacheCorruptionException("Model payload missing or truncated");
        }
        ModelCodec<?> codec = codecFor(expected);
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            int magic = in.readInt();
            if (magic != MAGIC) {
                throw new CacheCorruptionException(String.format("Bad magic 0x%08X", magic));
            }
            byte version = in.readByte();
            if (version != FORMAT_VERSION) {
                throw new CacheCorruptionException("Unsupported model format version " + version);
            }
            byte kindCode = in.readByte();
            if (kindCode != codec.kindCode()) {
                throw new CacheCorruptionException("Model kind code " + kindCode + " does not match "
                        + expected.getCode() + " (" + codec.kindCode() + ")");
            }
            long checksum = in.readLong();
            int length = in.readInt();
            if (length < 0 || length != data.length - 18) {
                throw new CacheCorruptionException("Payload length " + length + " does not match record size");
            }
            byte[] compressed = new byte[length];
            in.readFully(compressed);

            CRC32 crc = new CRC32();
            crc.update(compressed);
            if (crc.getValue() != checksum) {
                throw new CacheCorruptionException("Checksum mismatch for " + expected.getCode() + " model");
            }
            return codec.decode(gunzip(compressed));
        } catch (IOException | RuntimeException e) {
            if (e instanceof CacheCorruptionException) {
                throw (CacheCorruptionException) e;
            }
            throw new CacheCorruptionException("Unreadable " + expected.getCode() + " model: " + e.getMessage(), e);
        }
    }

    private ModelCodec<?> codecFor(DetectorKind kind) {
        ModelCodec<?> codec = codecs.get(kind);
        if (codec == null) {
            throw new IllegalArgumentException("No model codec registered for " + kind);
        }
        return codec;
    }

    private static <M extends OutlierModel> byte[] encode(ModelCodec<M> codec, OutlierModel model) throws IOException {
        return codec.encode(codec.modelClass().cast(model));
    }

    private static byte[] gzip(byte[] raw) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(raw.length / 2 + 64);
        try (GZIPOutputStream out = new GZIPOutputStream(bytes)) {
            out.write(raw);
        }
        return bytes.toByteArray();
    }

    private static byte[] gunzip(byte[] compressed) throws IOException {
        try (GZIPInputStream in = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return in.readAllBytes();
        }
    }
}
