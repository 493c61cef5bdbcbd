package org.ftpmcp.ftp;

import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPReply;
import org.ftpmcp.ftp.listing.DirectoryEntry;
import org.ftpmcp.ftp.listing.ListingParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 远程文件操作。每个方法独占一次 FTP 会话（见 {@link #execute}）。
 * <p>
 * 路径参数应当已经过 {@link RemotePaths#normalize} 规范化。
 */
public class RemoteFileService {

    private static final Logger logger = LoggerFactory.getLogger(RemoteFileService.class);

    /**
     * byte[] 的实际上限。
     */
    private static final long MAX_ARRAY_BYTES = Integer.MAX_VALUE - 8L;

    private final FtpSessionFactory sessionFactory;
    private final ListingParser listingParser;

    public RemoteFileService(FtpSessionFactory sessionFactory, ListingParser listingParser) {
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        this.listingParser = Objects.requireNonNull(listingParser, "listingParser");
    }

    /**
     * 在一次性会话中执行回调：打开会话、执行、登出并断开。
     * <p>
     * {@link IOException}（包括服务器返回的否定应答）统一转换为 {@link IllegalStateException}，并记录一次 ERROR 日志；
     * 回调抛出的运行时异常原样传播。
     */
    public <T> T execute(FtpConnectionSettings settings, String action, String path, SessionCallback<T> callback) {
        FTPClient client = null;
        try {
            client = sessionFactory.open(settings);
            return callback.doInSession(client);
        } catch (IOException e) {
            logger.error("FTP {} 失败：{}:{} {}", action, settings.host(), settings.port(), path, e);
            throw new IllegalStateException("FTP " + action + " 失败（" + path + "）：" + e.getMessage(), e);
        } finally {
            sessionFactory.close(client);
        }
    }

    /**
     * 读取 LIST 原始文本并逐行解析；无法识别的行以原文作为名称返回。
     */
    public List<DirectoryEntry> list(FtpConnectionSettings settings, String path) {
        String rawText = execute(settings, "LIST", path, client -> {
            // initiateListParsing 内部已读取完整个数据连接并完成 226 应答
            FTPFile[] files = client.initiateListParsing(RawListingEntryParser.KEY, path).getFiles();
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw replyFailure(client, "LIST " + path);
            }
            List<String> lines = new ArrayList<>(files.length);
            for (FTPFile file : files) {
                lines.add(file.getRawListing());
            }
            return String.join("\n", lines);
        });
        List<DirectoryEntry> entries = listingParser.parse(rawText);
        logger.info("LIST {}:{} {} -> {} 项", settings.host(), settings.port(), path, entries.size());
        return entries;
    }

    /**
     * 下载整个文件；超过 {@code maxBytes} 时报错（不截断）。
     */
    public byte[] download(FtpConnectionSettings settings, String path, long maxBytes) {
        if (maxBytes <= 0) {
            throw new IllegalArgumentException("maxBytes 必须大于 0");
        }
        long limit = readLimit(maxBytes);
        byte[] data = execute(settings, "RETR", path, client -> {
            InputStream in = client.retrieveFileStream(path);
            if (in == null) {
                throw replyFailure(client, "RETR " + path);
            }
            byte[] bytes;
            try (in) {
                bytes = in.readNBytes((int) (limit + 1));
            }
            if (bytes.length > limit) {
                throw new IllegalArgumentException("文件过大（超过 " + limit + " 字节）：" + path);
            }
            if (!client.completePendingCommand()) {
                throw replyFailure(client, "RETR " + path);
            }
            return bytes;
        });
        logger.info("RETR {}:{} {} -> {} 字节", settings.host(), settings.port(), path, data.length);
        return data;
    }

    /**
     * 实际生效的下载上限：多读 1 字节用于判断是否超限，所以上限必须比数组最大长度小 1。
     */
    static long readLimit(long maxBytes) {
        return Math.min(maxBytes, MAX_ARRAY_BYTES - 1);
    }

    /**
     * 上传（覆盖）文件；父目录不存在时逐级创建。
     */
    public void upload(FtpConnectionSettings settings, String path, byte[] content) {
        Objects.requireNonNull(content, "content");
        execute(settings, "STOR", path, client -> {
            ensureDirectories(client, RemotePaths.parentDirectory(path));
            try (InputStream in = new ByteArrayInputStream(content)) {
                if (!client.storeFile(path, in)) {
                    throw replyFailure(client, "STOR " + path);
                }
            }
            return null;
        });
        logger.info("STOR {}:{} {} <- {} 字节", settings.host(), settings.port(), path, content.length);
    }

    public void deleteFile(FtpConnectionSettings settings, String path) {
        execute(settings, "DELE", path, client -> {
            if (!client.deleteFile(path)) {
                throw replyFailure(client, "DELE " + path);
            }
            return null;
        });
        logger.info("DELE {}:{} {}", settings.host(), settings.port(), path);
    }

    /**
     * 创建目录（含缺失的上级目录）；目录已存在时视为成功。
     */
    public void makeDirectory(FtpConnectionSettings settings, String path) {
        execute(settings, "MKD", path, client -> {
            ensureDirectories(client, path);
            return null;
        });
        logger.info("MKD {}:{} {}", settings.host(), settings.port(), path);
    }

    /**
     * 删除目录（目录必须为空）。
     */
    public void removeDirectory(FtpConnectionSettings settings, String path) {
        execute(settings, "RMD", path, client -> {
            if (!client.removeDirectory(path)) {
                throw replyFailure(client, "RMD " + path);
            }
            return null;
        });
        logger.info("RMD {}:{} {}", settings.host(), settings.port(), path);
    }

    public void rename(FtpConnectionSettings settings, String from, String to) {
        execute(settings, "RNFR/RNTO", from, client -> {
            if (!client.rename(from, to)) {
                throw replyFailure(client, "RNFR " + from + " / RNTO " + to);
            }
            return null;
        });
        logger.info("RENAME {}:{} {} -> {}", settings.host(), settings.port(), from, to);
    }

    public long size(FtpConnectionSettings settings, String path) {
        logger.info("SIZE {}:{} {}", settings.host(), settings.port(), path);
        return execute(settings, "SIZE", path, client -> {
            String reply = client.getSize(path);
            if (reply == null) {
                throw replyFailure(client, "SIZE " + path);
            }
            try {
                return Long.parseLong(reply.trim());
            } catch (NumberFormatException e) {
                throw new IOException("SIZE 应答无法解析：" + reply.trim(), e);
            }
        });
    }

    public Instant modifiedTime(FtpConnectionSettings settings, String path) {
        logger.info("MDTM {}:{} {}", settings.host(), settings.port(), path);
        return execute(settings, "MDTM", path, client -> {
            FTPFile file = client.mdtmFile(path);
            if (file == null || file.getTimestamp() == null) {
                throw replyFailure(client, "MDTM " + path);
            }
            return file.getTimestamp().toInstant();
        });
    }

    /**
     * 从根开始逐级进入目录，不存在则创建。
     */
    private static void ensureDirectories(FTPClient client, String directory) throws IOException {
        String normalized = RemotePaths.normalize(directory, RemotePaths.ROOT);
        List<String> segments = Arrays.stream(normalized.split("/"))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        String current = "";
        for (String segment : segments) {
            current = current + "/" + segment;
            if (!client.changeWorkingDirectory(current) && !client.makeDirectory(current)) {
                throw replyFailure(client, "MKD " + current);
            }
        }
    }

    private static IOException replyFailure(FTPClient client, String command) {
        return new IOException(command + " -> " + FtpSessionFactory.replyOf(client));
    }

    /**
     * 会话内执行的操作。
     */
    @FunctionalInterface
    public interface SessionCallback<T> {
        T doInSession(FTPClient client) throws IOException;
    }
}
