package org.ftpmcp.ftp.content;

/**
 * 统计型编码探测（分类流程的第一阶段）。
 * <p>
 * 只给出“候选编码 + 置信度”，不负责验证候选编码能否真正解码整个缓冲区；验证由 {@link StrictDecoder} 完成。
 */
public interface EncodingDetector {

    /**
     * @param bytes 待探测的字节（非空）
     * @return 探测结果；没有任何候选时返回 {@link Detection#none()}
     */
    Detection detect(byte[] bytes);

    /**
     * @param charsetName 候选编码名（探测器的原始命名，可能为 null）
     * @param confidence  置信度 [0,1]
     */
    record Detection(String charsetName, double confidence) {

        private static final Detection NONE = new Detection(null, 0.0);

        public static Detection none() {
            return NONE;
        }

        public boolean hasCandidate() {
            return charsetName != null && !charsetName.isBlank();
        }
    }
}
