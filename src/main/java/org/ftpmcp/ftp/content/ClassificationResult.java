package org.ftpmcp.ftp.content;

/**
 * 内容分类结果：文本（附带编码与解码后的内容）或二进制。
 *
 * @param text         是否判定为文本
 * @param encodingName 文本时为规范化的小写编码名（例如 utf-8、windows-1252）；二进制时固定为 {@value #BINARY_ENCODING}
 * @param decodedText  解码后的文本（仅文本时非空）
 * @param confidence   编码探测的置信度 [0,1]，仅用于诊断；最终结论还取决于严格解码是否成功
 */
public record ClassificationResult(
        boolean text,
        String encodingName,
        String decodedText,
        double confidence
) {

    public static final String BINARY_ENCODING = "base64";

    public static ClassificationResult text(String encodingName, String decodedText, double confidence) {
        return new ClassificationResult(true, encodingName, decodedText, confidence);
    }

    public static ClassificationResult binary(double confidence) {
        return new ClassificationResult(false, BINARY_ENCODING, null, confidence);
    }
}
