package org.ftpmcp.ftp.content;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.Optional;

/**
 * 内容分类器：判断下载得到的字节是文本（以及用哪种编码）还是二进制。
 * <p>
 * 两阶段流程：
 * <ol>
 *   <li>{@link EncodingDetector} 给出候选编码与置信度；置信度低于阈值（默认 0.80）直接按二进制处理。</li>
 *   <li>{@link StrictDecoder} 用候选编码严格解码整个缓冲区；失败同样按二进制处理。</li>
 * </ol>
 * 误判为二进制只会让调用方拿到 base64（安全），误判为文本则会输出乱码，因此阈值偏保守。
 * <p>
 * 对任意非 null 输入本方法都会返回结果，不抛异常；空缓冲区视为空文本。
 */
public class ContentClassifier {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.80;

    private static final Logger logger = LoggerFactory.getLogger(ContentClassifier.class);

    private final EncodingDetector detector;
    private final CharsetRegistry registry;
    private final double minConfidence;

    public ContentClassifier(EncodingDetector detector, CharsetRegistry registry) {
        this(detector, registry, DEFAULT_MIN_CONFIDENCE);
    }

    public ContentClassifier(EncodingDetector detector, CharsetRegistry registry, double minConfidence) {
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalArgumentException("minConfidence 必须位于 [0,1]：" + minConfidence);
        }
        this.detector = Objects.requireNonNull(detector, "detector");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.minConfidence = minConfidence;
    }

    public ClassificationResult classify(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes");
        if (bytes.length == 0) {
            return ClassificationResult.text(CharsetRegistry.canonicalName(StandardCharsets.UTF_8), "", 1.0);
        }

        EncodingDetector.Detection detection = detectQuietly(bytes);
        if (!isAccepted(detection)) {
            return ClassificationResult.binary(detection.confidence());
        }

        Optional<Charset> charset = registry.lookup(detection.charsetName());
        if (charset.isEmpty()) {
            return ClassificationResult.binary(detection.confidence());
        }

        return StrictDecoder.decode(bytes, charset.get())
                .map(text -> ClassificationResult.text(CharsetRegistry.canonicalName(charset.get()), text, detection.confidence()))
                .orElseGet(() -> ClassificationResult.binary(detection.confidence()));
    }

    /**
     * 置信度门槛：有候选编码且置信度不低于阈值。
     */
    public boolean isAccepted(EncodingDetector.Detection detection) {
        return detection != null && detection.hasCandidate() && detection.confidence() >= minConfidence;
    }

    private EncodingDetector.Detection detectQuietly(byte[] bytes) {
        try {
            EncodingDetector.Detection detection = detector.detect(bytes);
            return detection != null ? detection : EncodingDetector.Detection.none();
        } catch (RuntimeException e) {
            // 探测器内部异常只影响本次分类结论（按二进制返回），不向上传播
            logger.warn("Encoding detection failed for {} bytes, treating content as binary", bytes.length, e);
            return EncodingDetector.Detection.none();
        }
    }
}
