package com.example.photoindex.extract;

import ai.onnxruntime.OnnxTensor;
import ai.onnxruntime.OnnxValue;
import ai.onnxruntime.OrtEnvironment;
import ai.onnxruntime.OrtException;
import ai.onnxruntime.OrtSession;
import com.example.photoindex.similarity.CosineSimilarity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.FloatBuffer;
import java.nio.file.Path;
import java.util.Collections;

/**
 * Image embeddings from an ONNX vision backbone (ResNet/MobileNet/DINO style, NCHW float input).
 *
 * <p>Input is resized to a square {@code inputSize}, converted to RGB and normalised with the ImageNet
 * mean and standard deviation. The first model output is flattened and L2-normalised so that
 * cosine similarity reduces to a dot product.</p>
 */
public class OnnxFeatureExtractor implements FeatureExtractor {

    private static final Logger log = LoggerFactory.getLogger(OnnxFeatureExtractor.class);

    private static final float[] MEAN = {0.485f, 0.456f, 0.406f};
    private static final float[] STD = {0.229f, 0.224f, 0.225f};
    private static final int CHANNELS = 3;

    private final OrtEnvironment env;
    private final OrtSession session;
    private final String inputName;
    private final int inputSize;
    private final String version;
    private final Object lock = new Object();

    public OnnxFeatureExtractor(Path modelPath, int inputSize) throws OrtException {
        if (modelPath == null) {
            throw new IllegalArgumentException("ONNX model path cannot be null");
        }
        if (inputSize <= 0) {
            throw new IllegalArgumentException("inputSize must be positive");
        }

        this.env = OrtEnvironment.getEnvironment();
        this.session = env.createSession(modelPath.toString(), new OrtSession.SessionOptions());
        this.inputName = session.getInputNames().iterator().next();
        this.inputSize = inputSize;
        this.version = "onnx:" + modelPath.getFileName() + "/" + inputSize;

        log.info("ONNX feature extractor initialized: model={} input={} outputs={} size={}",
                modelPath, inputName, session.getOutputNames(), inputSize);
    }

    @Override
    public ExtractionResult extract(DecodedImage image, int maxDimension) {
        if (image == null) {
            return ExtractionResult.failure(FailureKind.EXTRACTION, "No image to extract from");
        }
        DecodedImage bounded = OpenCvImages.fitWithin(image, maxDimension);
        float[] chw = toNormalizedChw(OpenCvImages.resize(bounded, inputSize, inputSize));

        synchronized (lock) {
            long[] shape = new long[]{1, CHANNELS, inputSize, inputSize};
            try (OnnxTensor tensor = OnnxTensor.createTensor(env, FloatBuffer.wrap(chw), shape);
                 OrtSession.Result result = session.run(Collections.singletonMap(inputName, tensor))) {
                float[] embedding = flatten(result.get(0));
                if (embedding.length == 0) {
                    return ExtractionResult.failure(FailureKind.EXTRACTION, "Model returned an empty output");
                }
                return ExtractionResult.success(CosineSimilarity.normalize(embedding));
            } catch (OrtException | IllegalStateException e) {
                log.warn("Feature extraction failed: {}", e.getMessage());
                return ExtractionResult.failure(FailureKind.EXTRACTION, e.getMessage());
            }
        }
    }

    @Override
    public String version() {
        return version;
    }

    /**
     * BGR interleaved bytes to RGB planar floats with ImageNet normalisation.
     */
    static float[] toNormalizedChw(DecodedImage image) {
        int h = image.getHeight();
        int w = image.getWidth();
        float[] chwData = new float[CHANNELS * h * w];

        int plane = h * w;
        for (int row = 0; row < h; row++) {
            for (int col = 0; col < w; col++) {
                int[] bgr = image.bgr(col, row);
                int offset = row * w + col;
                for (int ch = 0; ch < CHANNELS; ch++) {
                    float value = bgr[2 - ch] / 255.0f;
                    chwData[ch * plane + offset] = (value - MEAN[ch]) / STD[ch];
                }
            }
        }
        return chwData;
    }

    /**
     * Models export either pooled [1, D] outputs or unpooled [1, D, 1, 1] feature maps.
     */
    private static float[] flatten(OnnxValue output) throws OrtException {
        Object value = output.getValue();
        if (value instanceof float[][]) {
            return ((float[][]) value)[0];
        }
        if (value instanceof float[][][][]) {
            float[][][] maps = ((float[][][][]) value)[0];
            float[] pooled = new float[maps.length];
            for (int d = 0; d < maps.length; d++) {
                double sum = 0.0;
                int n = 0;
                for (float[] line : maps[d]) {
                    for (float v : line) {
                        sum += v;
                        n++;
                    }
                }
                pooled[d] = n == 0 ? 0f : (float) (sum / n);
            }
            return pooled;
        }
        if (value instanceof float[]) {
            return (float[]) value;
        }
        throw new IllegalStateException("Unsupported model output type: " + value.getClass().getSimpleName());
    }

    @Override
    public void close() throws OrtException {
        synchronized (lock) {
            if (session != null) {
                session.close();
            }
        }
    }
}
