package org.ftpmcp.ftp;

import org.ftpmcp.ftp.listing.DirectoryEntry;
import org.ftpmcp.ftp.listing.ListingParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemoteFileServiceTest {

    @TempDir
    Path home;

    private EmbeddedFtpServer ftpServer;
    private RemoteFileService service;

    @BeforeEach
    void setUp() throws Exception {
        ftpServer = EmbeddedFtpServer.start(home);
        service = new RemoteFileService(new FtpSessionFactory(), new ListingParser());
    }

    @AfterEach
    void tearDown() {
        ftpServer.close();
    }

    @Test
    void list_parsesServerListing() throws Exception {
        Files.createDirectory(home.resolve("sub"));
        Files.writeString(home.resolve("my file.txt"), "hello");

        List<DirectoryEntry> entries = service.list(ftpServer.settings(), "/");

        assertThat(entries).extracting(DirectoryEntry::name).containsExactlyInAnyOrder("sub", "my file.txt");
        DirectoryEntry dir = entries.stream().filter(e -> e.name().equals("sub")).findFirst().orElseThrow();
        DirectoryEntry file = entries.stream().filter(e -> e.name().equals("my file.txt")).findFirst().orElseThrow();
        assertThat(dir.directory()).isTrue();
        assertThat(file.directory()).isFalse();
        assertThat(file.size()).isEqualTo(5L);
        assertThat(file.permissions()).startsWith("-r");
        assertThat(file.modifiedAt()).isNotNull();
    }

    @Test
    void list_emptyDirectory() throws Exception {
        Files.createDirectory(home.resolve("empty"));

        assertThat(service.list(ftpServer.settings(), "/empty")).isEmpty();
    }

    @Test
    void upload_createsParentDirectoriesAndDownloadReturnsSameBytes() throws Exception {
        byte[] content = {0x00, 0x01, (byte) 0xFF, 'a', '\r', '\n'};

        service.upload(ftpServer.settings(), "/docs/nested/data.bin", content);

        assertThat(Files.readAllBytes(home.resolve("docs/nested/data.bin"))).isEqualTo(content);
        assertThat(service.download(ftpServer.settings(), "/docs/nested/data.bin", 1024)).isEqualTo(content);
    }

    @Test
    void download_rejectsFileLargerThanLimit() throws Exception {
        Files.write(home.resolve("big.bin"), new byte[100]);

        assertThatThrownBy(() -> service.download(ftpServer.settings(), "/big.bin", 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("/big.bin");
    }

    @Test
    void download_fileExactlyAtLimitIsAccepted() throws Exception {
        Files.write(home.resolve("edge.bin"), new byte[10]);

        assertThat(service.download(ftpServer.settings(), "/edge.bin", 10)).hasSize(10);
    }

    @Test
    void readLimit_hugeConfiguredLimitStillLeavesRoomForOverflowByte() {
        long limit = RemoteFileService.readLimit(Long.MAX_VALUE);

        assertThat(limit + 1).isLessThanOrEqualTo(Integer.MAX_VALUE - 8L);
        assertThat(RemoteFileService.readLimit(16)).isEqualTo(16);
    }

    @Test
    void download_missingFileIsFtpFailure() {
        assertThatThrownBy(() -> service.download(ftpServer.settings(), "/missing.txt", 1024))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("RETR");
    }

    @Test
    void makeDirectory_createsMissingParentsAndToleratesExisting() {
        service.makeDirectory(ftpServer.settings(), "/a/b/c");
        service.makeDirectory(ftpServer.settings(), "/a/b/c");

        assertThat(home.resolve("a/b/c")).isDirectory();
    }

    @Test
    void removeDirectory_deletesEmptyDirectory() throws Exception {
        Files.createDirectory(home.resolve("gone"));

        service.removeDirectory(ftpServer.settings(), "/gone");

        assertThat(home.resolve("gone")).doesNotExist();
    }

    @Test
    void deleteFile_removesFileAndFailsWhenMissing() throws Exception {
        Files.writeString(home.resolve("old.txt"), "x");

        service.deleteFile(ftpServer.settings(), "/old.txt");

        assertThat(home.resolve("old.txt")).doesNotExist();
        assertThatThrownBy(() -> service.deleteFile(ftpServer.settings(), "/old.txt"))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rename_movesFile() throws Exception {
        Files.writeString(home.resolve("before.txt"), "x");

        service.rename(ftpServer.settings(), "/before.txt", "/after.txt");

        assertThat(home.resolve("before.txt")).doesNotExist();
        assertThat(home.resolve("after.txt")).hasContent("x");
    }

    @Test
    void sizeAndModifiedTime() throws Exception {
        Path file = home.resolve("stamp.txt");
        Files.writeString(file, "0123456789", StandardCharsets.US_ASCII);
        Instant stamp = Instant.parse("2024-03-01T10:15:30Z");
        Files.setLastModifiedTime(file, FileTime.from(stamp));

        assertThat(service.size(ftpServer.settings(), "/stamp.txt")).isEqualTo(10L);
        assertThat(service.modifiedTime(ftpServer.settings(), "/stamp.txt")).isEqualTo(stamp);
    }

    @Test
    void wrongPasswordIsLoginFailure() {
        assertThatThrownBy(() -> service.size(ftpServer.settings("wrong"), "/x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("登录失败");
    }
}
