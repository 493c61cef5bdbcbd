package org.ftpmcp.ftp.content;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class IcuEncodingDetectorTest {

    private final IcuEncodingDetector detector = new IcuEncodingDetector(CharsetRegistry.initialize());

    @Test
    void detect_plainAsciiReportsUtf8WithFullConfidence() {
        EncodingDetector.Detection detection = detector.detect("line one\r\nline\ttwo\n".getBytes(StandardCharsets.US_ASCII));

        assertThat(detection.charsetName()).isEqualTo("UTF-8");
        assertThat(detection.confidence()).isEqualTo(1.0);
    }

    @Test
    void detect_emptyInputHasNoCandidate() {
        assertThat(detector.detect(new byte[0]).hasCandidate()).isFalse();
    }

    @Test
    void detect_multiByteUtf8() {
        byte[] bytes = "编码检测：这是一段足够长的中文文本，用于验证 UTF-8 识别。".getBytes(StandardCharsets.UTF_8);

        EncodingDetector.Detection detection = detector.detect(bytes);

        assertThat(detection.charsetName()).isEqualToIgnoringCase("UTF-8");
        assertThat(detection.confidence()).isGreaterThanOrEqualTo(ContentClassifier.DEFAULT_MIN_CONFIDENCE);
    }

    @Test
    void isPlainAscii_rejectsControlAndHighBytes() {
        assertThat(IcuEncodingDetector.isPlainAscii("ok\n".getBytes(StandardCharsets.US_ASCII))).isTrue();
        assertThat(IcuEncodingDetector.isPlainAscii(new byte[]{'a', 0x00})).isFalse();
        assertThat(IcuEncodingDetector.isPlainAscii(new byte[]{'a', (byte) 0xC3})).isFalse();
    }
}
