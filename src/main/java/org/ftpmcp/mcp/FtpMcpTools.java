package org.ftpmcp.mcp;

import org.ftpmcp.ftp.ConnectionTokenDecoder;
import org.ftpmcp.ftp.FtpConnectionSettings;
import org.ftpmcp.ftp.FtpServerProperties;
import org.ftpmcp.ftp.RemoteFileService;
import org.ftpmcp.ftp.RemotePaths;
import org.ftpmcp.ftp.content.CharsetRegistry;
import org.ftpmcp.ftp.content.ClassificationResult;
import org.ftpmcp.ftp.content.ContentClassifier;
import org.ftpmcp.ftp.content.MimeTypes;
import org.ftpmcp.ftp.dto.DirectoryListResult;
import org.ftpmcp.ftp.dto.FileReadResult;
import org.ftpmcp.ftp.dto.FileSizeResult;
import org.ftpmcp.ftp.dto.FileWriteResult;
import org.ftpmcp.ftp.dto.ModifiedTimeResult;
import org.ftpmcp.ftp.dto.RemoteFileEntry;
import org.ftpmcp.ftp.dto.RemoteOperationResult;
import org.ftpmcp.ftp.listing.DirectoryEntry;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.regex.Pattern;

/**
 * FTP MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列目录（{@code ftp_list_directory}）：多方言 LIST 解析，无法识别的行原样返回。</li>
 *   <li>读文件（{@code ftp_read_file}）：自动判定文本/二进制，文本按检测到的编码解码，二进制返回 base64。</li>
 *   <li>写文件（{@code ftp_upload_file} 原始字节、{@code ftp_write_file} 指定编码的文本）。</li>
 *   <li>删除/建目录/删目录/重命名/查询大小/查询修改时间。</li>
 * </ul>
 * <p>
 * 连接参数默认来自 {@code app.ftp.*}；每个工具都可以通过 {@code connectionToken} 临时覆盖（需
 * {@code app.ftp.allow-connection-token=true}）。
 */
@Component
public class FtpMcpTools {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String CONNECTION_TOKEN_DESCRIPTION =
            "可选连接令牌：base64(JSON 或 server:port:username:password:dir)，用于覆盖服务端默认的 FTP 连接参数";

    private final FtpServerProperties properties;
    private final RemoteFileService remoteFileService;
    private final ContentClassifier contentClassifier;
    private final CharsetRegistry charsetRegistry;
    private final ConnectionTokenDecoder tokenDecoder;

    public FtpMcpTools(FtpServerProperties properties,
                       RemoteFileService remoteFileService,
                       ContentClassifier contentClassifier,
                       CharsetRegistry charsetRegistry,
                       ConnectionTokenDecoder tokenDecoder) {
        this.properties = properties;
        this.remoteFileService = remoteFileService;
        this.contentClassifier = contentClassifier;
        this.charsetRegistry = charsetRegistry;
        this.tokenDecoder = tokenDecoder;
    }

    @Tool(
            name = "ftp_list_directory",
            description = "列出 FTP 目录下的文件/子目录（支持 Unix ls -l 与 DOS/IIS 两种列表格式；无法识别的行以原文作为名称返回）。"
    )
    public DirectoryListResult listDirectory(
            @ToolParam(required = false, description = "远程目录路径（例如 /pub；为空则使用默认目录）") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());

        List<DirectoryEntry> parsed = remoteFileService.list(settings, remotePath);
        List<RemoteFileEntry> entries = new ArrayList<>(parsed.size());
        int unrecognized = 0;
        for (DirectoryEntry entry : parsed) {
            if (isUnrecognized(entry)) {
                unrecognized++;
            }
            entries.add(new RemoteFileEntry(
                    entry.name(),
                    RemotePaths.combine(remotePath, entry.name()),
                    entry.directory(),
                    entry.size(),
                    entry.modifiedAt(),
                    entry.permissions(),
                    entry.rawLine()
            ));
        }

        List<String> warnings = new ArrayList<>();
        if (unrecognized > 0) {
            warnings.add(unrecognized + " 行无法识别为 Unix/DOS 列表格式，已按原文返回（例如 total 行）。");
        }
        return new DirectoryListResult(
                settings.host(),
                settings.port(),
                remotePath,
                settings.ssl(),
                settings.passive(),
                entries,
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "ftp_read_file",
            description = "下载并读取 FTP 文件；文本返回解码后的字符串及检测到的编码，二进制返回 base64（大小上限 app.ftp.read-max-bytes）。"
    )
    /**
     * 读取文件内容。
     * <p>
     * 文本/二进制由内容决定（编码检测 + 严格解码），扩展名只用于 MIME 类型。
     */
    public FileReadResult readFile(
            @ToolParam(description = "远程文件路径（例如 /pub/readme.txt）") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());

        byte[] bytes = remoteFileService.download(settings, remotePath, properties.getReadMaxBytes().toBytes());
        ClassificationResult classification = contentClassifier.classify(bytes);
        String mimeType = MimeTypes.effective(MimeTypes.resolve(remotePath), classification);
        String content = classification.text()
                ? classification.decodedText()
                : Base64.getEncoder().encodeToString(bytes);

        return new FileReadResult(
                remotePath,
                RemotePaths.toUri(settings.host(), settings.port(), remotePath),
                mimeType,
                classification.encodingName(),
                !classification.text(),
                classification.confidence(),
                bytes.length,
                content
        );
    }

    @Tool(
            name = "ftp_upload_file",
            description = "上传文件到 FTP 服务器（内容为 base64；覆盖已有文件，父目录不存在时自动创建）。"
    )
    public FileWriteResult uploadFile(
            @ToolParam(description = "远程文件路径（例如 /incoming/file.bin）") String path,
            @ToolParam(description = "base64 编码的文件内容") String dataBase64,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(dataBase64 == null ? "" : WHITESPACE.matcher(dataBase64).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("dataBase64 不是合法的 base64", e);
        }

        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        remoteFileService.upload(settings, remotePath, bytes);
        return new FileWriteResult(
                remotePath,
                RemotePaths.toUri(settings.host(), settings.port(), remotePath),
                null,
                bytes.length,
                Instant.now()
        );
    }

    @Tool(
            name = "ftp_write_file",
            description = "把文本写入 FTP 文件（默认 UTF-8 且不带 BOM；可指定编码，例如 gbk、iso-8859-1、shift_jis）。"
    )
    public FileWriteResult writeFile(
            @ToolParam(description = "远程文件路径（例如 /incoming/notes.txt）") String path,
            @ToolParam(description = "要写入的文本内容") String content,
            @ToolParam(required = false, description = "文本编码名（默认 utf-8）") String encoding,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        // 编码名不合法时在连接服务器之前就报错
        Charset charset = (encoding == null || encoding.isBlank())
                ? StandardCharsets.UTF_8
                : charsetRegistry.require(encoding);
        byte[] bytes = (content == null ? "" : content).getBytes(charset);

        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        remoteFileService.upload(settings, remotePath, bytes);
        return new FileWriteResult(
                remotePath,
                RemotePaths.toUri(settings.host(), settings.port(), remotePath),
                CharsetRegistry.canonicalName(charset),
                bytes.length,
                Instant.now()
        );
    }

    @Tool(
            name = "ftp_delete_file",
            description = "删除 FTP 服务器上的文件。"
    )
    public RemoteOperationResult deleteFile(
            @ToolParam(description = "远程文件路径") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        remoteFileService.deleteFile(settings, remotePath);
        return operationResult("delete", settings, remotePath, null);
    }

    @Tool(
            name = "ftp_make_directory",
            description = "在 FTP 服务器上创建目录（缺失的上级目录会一并创建；目录已存在视为成功）。"
    )
    public RemoteOperationResult makeDirectory(
            @ToolParam(description = "远程目录路径（例如 /pub/newdir）") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        remoteFileService.makeDirectory(settings, remotePath);
        return operationResult("mkdir", settings, remotePath, null);
    }

    @Tool(
            name = "ftp_remove_directory",
            description = "删除 FTP 服务器上的目录（目录必须为空）。"
    )
    public RemoteOperationResult removeDirectory(
            @ToolParam(description = "远程目录路径（必须为空目录）") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        remoteFileService.removeDirectory(settings, remotePath);
        return operationResult("rmdir", settings, remotePath, null);
    }

    @Tool(
            name = "ftp_rename",
            description = "重命名 FTP 服务器上的文件或目录（newName 只是新名称，不是完整路径；结果仍位于原目录）。"
    )
    public RemoteOperationResult rename(
            @ToolParam(description = "当前远程路径") String path,
            @ToolParam(description = "新名称（不含目录）") String newName,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("newName 不能为空");
        }
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        String destination = RemotePaths.combine(RemotePaths.parentDirectory(remotePath), newName.trim());
        remoteFileService.rename(settings, remotePath, destination);
        return operationResult("rename", settings, remotePath, destination);
    }

    @Tool(
            name = "ftp_get_file_size",
            description = "查询远程文件大小（字节，SIZE 命令）。"
    )
    public FileSizeResult getFileSize(
            @ToolParam(description = "远程文件路径") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        return new FileSizeResult(remotePath, remoteFileService.size(settings, remotePath));
    }

    @Tool(
            name = "ftp_get_modified_time",
            description = "查询远程文件的最后修改时间（MDTM 命令，UTC）。"
    )
    public ModifiedTimeResult getModifiedTime(
            @ToolParam(description = "远程文件路径") String path,
            @ToolParam(required = false, description = CONNECTION_TOKEN_DESCRIPTION) String connectionToken
    ) {
        FtpConnectionSettings settings = resolveSettings(connectionToken);
        String remotePath = RemotePaths.normalize(path, settings.defaultPath());
        return new ModifiedTimeResult(remotePath, remoteFileService.modifiedTime(settings, remotePath));
    }

    /**
     * 默认连接参数 + 可选的 connectionToken 覆盖。
     */
    private FtpConnectionSettings resolveSettings(String connectionToken) {
        FtpConnectionSettings settings = FtpConnectionSettings.fromProperties(properties);
        if (connectionToken != null && !connectionToken.isBlank()) {
            if (!properties.isAllowConnectionToken()) {
                throw new IllegalArgumentException("服务端已禁用 connectionToken（app.ftp.allow-connection-token=false）");
            }
            settings = settings.withToken(tokenDecoder.decode(connectionToken));
        }
        return settings.requireHost();
    }

    private static RemoteOperationResult operationResult(String operation, FtpConnectionSettings settings,
                                                         String path, String targetPath) {
        return new RemoteOperationResult(
                operation,
                path,
                targetPath,
                RemotePaths.toUri(settings.host(), settings.port(), targetPath != null ? targetPath : path)
        );
    }

    private static boolean isUnrecognized(DirectoryEntry entry) {
        return entry.permissions() == null && entry.modifiedAt() == null && entry.size() == null && !entry.directory();
    }
}
