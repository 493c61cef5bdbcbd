package org.ftpmcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.ftpmcp.ftp.ConnectionTokenDecoder;
import org.ftpmcp.ftp.FtpConnectionSettings;
import org.ftpmcp.ftp.FtpServerProperties;
import org.ftpmcp.ftp.RemoteFileService;
import org.ftpmcp.ftp.content.CharsetRegistry;
import org.ftpmcp.ftp.content.ContentClassifier;
import org.ftpmcp.ftp.content.IcuEncodingDetector;
import org.ftpmcp.ftp.dto.DirectoryListResult;
import org.ftpmcp.ftp.dto.FileReadResult;
import org.ftpmcp.ftp.dto.FileWriteResult;
import org.ftpmcp.ftp.dto.RemoteOperationResult;
import org.ftpmcp.ftp.listing.ListingParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class FtpMcpToolsTest {

    private static final byte[] PNG_HEADER = {
            (byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A,
            0x00, 0x00, 0x00, 0x0D, 'I', 'H', 'D', 'R'
    };

    private FtpServerProperties properties;
    private RemoteFileService remoteFileService;
    private FtpMcpTools tools;

    @BeforeEach
    void setUp() {
        properties = new FtpServerProperties();
        properties.setHost("ftp.example.com");
        properties.setDefaultPath("/pub");
        remoteFileService = mock(RemoteFileService.class);
        CharsetRegistry registry = CharsetRegistry.initialize();
        tools = new FtpMcpTools(
                properties,
                remoteFileService,
                new ContentClassifier(new IcuEncodingDetector(registry), registry),
                registry,
                new ConnectionTokenDecoder()
        );
    }

    @Test
    void listDirectory_usesDefaultPathAndReportsUnrecognizedLines() {
        when(remoteFileService.list(any(), eq("/pub"))).thenReturn(new ListingParser().parse(
                "total 4\n-rw-r--r-- 1 u g 1234 Jan 20 2023 my file.txt\n"));

        DirectoryListResult result = tools.listDirectory(null, null);

        assertThat(result.path()).isEqualTo("/pub");
        assertThat(result.host()).isEqualTo("ftp.example.com");
        assertThat(result.entries()).hasSize(2);
        assertThat(result.entries().get(1).name()).isEqualTo("my file.txt");
        assertThat(result.entries().get(1).path()).isEqualTo("/pub/my file.txt");
        assertThat(result.entries().get(1).size()).isEqualTo(1234L);
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void listDirectory_entriesSerializeWithListingFieldNames() throws Exception {
        when(remoteFileService.list(any(), eq("/pub"))).thenReturn(new ListingParser().parse(
                "-rw-r--r-- 1 u g 1234 Jan 20 2023 my file.txt"));
        ObjectMapper mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();

        JsonNode entry = mapper.readTree(mapper.writeValueAsString(tools.listDirectory(null, null).entries().get(0)));

        assertThat(entry.fieldNames()).toIterable()
                .containsExactlyInAnyOrder("name", "path", "isDirectory", "size", "modified", "permissions", "raw");
        assertThat(entry.get("name").asText()).isEqualTo("my file.txt");
        assertThat(entry.get("isDirectory").asBoolean()).isFalse();
        assertThat(entry.get("size").asLong()).isEqualTo(1234L);
        assertThat(entry.get("modified").asText()).isEqualTo("2023-01-20T00:00:00");
        assertThat(entry.get("permissions").asText()).isEqualTo("-rw-r--r--");
    }

    @Test
    void readFile_textReturnsDecodedContent() {
        when(remoteFileService.download(any(), eq("/pub/readme.txt"), anyLong()))
                .thenReturn("hello".getBytes(StandardCharsets.US_ASCII));

        FileReadResult result = tools.readFile("readme.txt", null);

        assertThat(result.path()).isEqualTo("/pub/readme.txt");
        assertThat(result.binary()).isFalse();
        assertThat(result.encoding()).isEqualTo("utf-8");
        assertThat(result.content()).isEqualTo("hello");
        assertThat(result.mimeType()).isEqualTo("text/plain");
        assertThat(result.uri()).isEqualTo("ftp://ftp.example.com:21/pub/readme.txt");
    }

    @Test
    void readFile_binaryReturnsBase64() {
        when(remoteFileService.download(any(), eq("/img/logo.png"), anyLong())).thenReturn(PNG_HEADER);

        FileReadResult result = tools.readFile("/img/logo.png", null);

        assertThat(result.binary()).isTrue();
        assertThat(result.encoding()).isEqualTo("base64");
        assertThat(Base64.getDecoder().decode(result.content())).isEqualTo(PNG_HEADER);
        assertThat(result.mimeType()).isEqualTo("image/png");
        assertThat(result.sizeBytes()).isEqualTo(PNG_HEADER.length);
    }

    @Test
    void readFile_passesConfiguredSizeLimit() {
        when(remoteFileService.download(any(), any(), anyLong())).thenReturn(new byte[0]);

        tools.readFile("/a.txt", null);

        verify(remoteFileService).download(any(), eq("/a.txt"), eq(properties.getReadMaxBytes().toBytes()));
    }

    @Test
    void writeFile_encodesWithRequestedCharset() {
        Charset gbk = Charset.forName("GBK");

        FileWriteResult result = tools.writeFile("notes.txt", "中文", "GBK", null);

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(remoteFileService).upload(any(), eq("/pub/notes.txt"), bytes.capture());
        assertThat(bytes.getValue()).isEqualTo("中文".getBytes(gbk));
        assertThat(result.encoding()).isEqualTo("gbk");
        assertThat(result.bytesWritten()).isEqualTo(4);
    }

    @Test
    void writeFile_defaultsToUtf8WithoutBom() {
        tools.writeFile("/a.txt", "é", null, null);

        ArgumentCaptor<byte[]> bytes = ArgumentCaptor.forClass(byte[].class);
        verify(remoteFileService).upload(any(), eq("/a.txt"), bytes.capture());
        assertThat(bytes.getValue()).containsExactly((byte) 0xC3, (byte) 0xA9);
    }

    @Test
    void writeFile_unknownEncodingFailsBeforeConnecting() {
        assertThatThrownBy(() -> tools.writeFile("/a.txt", "x", "x-no-such-charset", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(remoteFileService);
    }

    @Test
    void uploadFile_decodesBase64() {
        FileWriteResult result = tools.uploadFile("/in/data.bin", Base64.getEncoder().encodeToString(PNG_HEADER), null);

        verify(remoteFileService).upload(any(), eq("/in/data.bin"), eq(PNG_HEADER));
        assertThat(result.bytesWritten()).isEqualTo(PNG_HEADER.length);
        assertThat(result.encoding()).isNull();
    }

    @Test
    void uploadFile_invalidBase64IsCallerError() {
        assertThatThrownBy(() -> tools.uploadFile("/in/data.bin", "***", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(remoteFileService);
    }

    @Test
    void rename_resolvesNewNameAgainstParentDirectory() {
        RemoteOperationResult result = tools.rename("/pub/docs/old.txt", "new.txt", null);

        verify(remoteFileService).rename(any(), eq("/pub/docs/old.txt"), eq("/pub/docs/new.txt"));
        assertThat(result.targetPath()).isEqualTo("/pub/docs/new.txt");
    }

    @Test
    void rename_fileInRootStaysInRoot() {
        tools.rename("/old.txt", "new.txt", null);

        verify(remoteFileService).rename(any(), eq("/old.txt"), eq("/new.txt"));
    }

    @Test
    void connectionToken_overridesConfiguredHost() {
        String token = Base64.getEncoder().encodeToString(
                "other.host:2121:bob:pw:/home".getBytes(StandardCharsets.UTF_8));

        tools.makeDirectory("new", token);

        ArgumentCaptor<FtpConnectionSettings> settings = ArgumentCaptor.forClass(FtpConnectionSettings.class);
        verify(remoteFileService).makeDirectory(settings.capture(), eq("/new"));
        assertThat(settings.getValue().host()).isEqualTo("other.host");
        assertThat(settings.getValue().port()).isEqualTo(2121);
        assertThat(settings.getValue().username()).isEqualTo("bob");
    }

    @Test
    void connectionToken_rejectedWhenDisabled() {
        properties.setAllowConnectionToken(false);
        String token = Base64.getEncoder().encodeToString("h:21:u:p:/".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> tools.deleteFile("/a.txt", token))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("allow-connection-token");
    }

    @Test
    void missingHostIsCallerError() {
        properties.setHost(null);

        assertThatThrownBy(() -> tools.getFileSize("/a.txt", null))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(remoteFileService);
    }
}
