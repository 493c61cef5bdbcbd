package org.ftpmcp.ftp;

import org.apache.commons.net.ftp.FTPClientConfig;
import org.apache.commons.net.ftp.FTPFile;
import org.apache.commons.net.ftp.FTPFileEntryParser;
import org.apache.commons.net.ftp.FTPFileEntryParserImpl;
import org.apache.commons.net.ftp.parser.FTPFileEntryParserFactory;

/**
 * 不做任何解析的 LIST 行解析器：每一行（包括 {@code total N}、空行）都原样保存在 {@link FTPFile#getRawListing()} 中，
 * 真正的解析交给 {@link org.ftpmcp.ftp.listing.ListingParser}。
 */
final class RawListingEntryParser extends FTPFileEntryParserImpl {

    static final String KEY = "RAW";

    static final FTPFileEntryParserFactory FACTORY = new FTPFileEntryParserFactory() {
        @Override
        public FTPFileEntryParser createFileEntryParser(String key) {
            return new RawListingEntryParser();
        }

        @Override
        public FTPFileEntryParser createFileEntryParser(FTPClientConfig config) {
            return new RawListingEntryParser();
        }
    };

    @Override
    public FTPFile parseFTPEntry(String listEntry) {
        FTPFile file = new FTPFile();
        file.setRawListing(listEntry);
        return file;
    }
}
