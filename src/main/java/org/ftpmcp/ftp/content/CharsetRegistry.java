package org.ftpmcp.ftp.content;

import com.ibm.icu.text.CharsetDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * 进程级的编码注册表：把编码探测器能识别的编码名映射到当前 JVM 可用的 {@link Charset}。
 * <p>
 * 必须先显式调用 {@link #initialize()}（幂等、线程安全）拿到实例，再交给 {@link ContentClassifier} 使用；
 * 不依赖静态初始化顺序。遗留代码页（windows-125x、Shift_JIS、GB18030 等）由 JDK 的 jdk.charsets 模块提供，
 * 精简运行时缺少该模块时对应编码会被记录为不可用，探测到这些编码的内容按二进制处理。
 */
public final class CharsetRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CharsetRegistry.class);

    private static volatile CharsetRegistry instance;

    private final Map<String, Charset> detectable;

    private CharsetRegistry(Map<String, Charset> detectable) {
        this.detectable = Collections.unmodifiableMap(detectable);
    }

    /**
     * 构建（或返回已构建的）进程级注册表。
     */
    public static CharsetRegistry initialize() {
        CharsetRegistry current = instance;
        if (current != null) {
            return current;
        }
        synchronized (CharsetRegistry.class) {
            if (instance == null) {
                instance = build();
            }
            return instance;
        }
    }

    private static CharsetRegistry build() {
        Map<String, Charset> detectable = new TreeMap<>();
        for (String name : CharsetDetector.getAllDetectableCharsets()) {
            Optional<Charset> charset = forName(name);
            if (charset.isPresent()) {
                detectable.put(name.toLowerCase(Locale.ROOT), charset.get());
            } else {
                logger.debug("Detectable charset {} is not available in this JVM", name);
            }
        }
        logger.info("Charset registry initialized with {} detectable charsets", detectable.size());
        return new CharsetRegistry(detectable);
    }

    /**
     * 按名称查找编码（大小写不敏感）；名称非法或 JVM 不支持时返回 empty，不抛异常。
     */
    public Optional<Charset> lookup(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        Charset known = detectable.get(key);
        if (known != null) {
            return Optional.of(known);
        }
        return forName(name.trim());
    }

    /**
     * 按名称查找编码；不支持时抛出 {@link IllegalArgumentException}（用于调用方显式指定编码的场景）。
     */
    public Charset require(String name) {
        return lookup(name).orElseThrow(() -> new IllegalArgumentException("不支持的编码：" + name));
    }

    public Set<String> detectableCharsets() {
        return detectable.keySet();
    }

    /**
     * 规范化的小写编码名，例如 {@code UTF-8 -> utf-8}。
     */
    public static String canonicalName(Charset charset) {
        return charset.name().toLowerCase(Locale.ROOT);
    }

    private static Optional<Charset> forName(String name) {
        try {
            return Optional.of(Charset.forName(name));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return Optional.empty();
        }
    }
}
