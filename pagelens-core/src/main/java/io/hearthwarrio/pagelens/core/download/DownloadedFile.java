package io.hearthwarrio.pagelens.core.download;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A file written by {@link FileDownloader}.
 */
public final class DownloadedFile {

    private final String url;
    private final String path;
    private final String filename;
    private final long sizeBytes;
    private final String sha256;
    private final String contentType;

    public DownloadedFile(String url, String path, String filename, long sizeBytes, String sha256, String contentType) {
        this.url = Objects.requireNonNull(url, "url must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.filename = Objects.requireNonNull(filename, "filename must not be null");
        this.sizeBytes = sizeBytes;
        this.sha256 = Objects.requireNonNull(sha256, "sha256 must not be null");
        this.contentType = contentType;
    }

    @JsonProperty("url")
    public String getUrl() {
        return url;
    }

    @JsonProperty("path")
    public String getPath() {
        return path;
    }

    @JsonProperty("filename")
    public String getFilename() {
        return filename;
    }

    @JsonProperty("size_bytes")
    public long getSizeBytes() {
        return sizeBytes;
    }

    @JsonProperty("sha256")
    public String getSha256() {
        return sha256;
    }

    /**
     * @return the {@code Content-Type} header, {@code null} when the server sent none
     */
    @JsonProperty("content_type")
    public String getContentType() {
        return contentType;
    }

    @Override
    public String toString() {
        return "DownloadedFile{" + filename + ", " + sizeBytes + " bytes, sha256=" + sha256 + "}";
    }
}
