package io.hearthwarrio.pagelens.core.download;

import io.hearthwarrio.pagelens.core.InvalidTaskException;
import io.hearthwarrio.pagelens.core.NavigationException;
import io.hearthwarrio.pagelens.core.config.DownloadSettings;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;

/**
 * Fetches a URL with jsoup and writes the body under the download directory.
 * <p>
 * Redirects are followed by hand so that every hop passes the {@link HostGuard}. The body is streamed to a temporary
 * file, hashed on the way and moved into place once complete; a body larger than {@code max_bytes} is discarded.
 */
public class FileDownloader {

    private static final Logger logger = LoggerFactory.getLogger(FileDownloader.class);

    static final int MAX_REDIRECTS = 5;
    static final String FALLBACK_NAME = "download";

    private final Path directory;
    private final int timeoutMs;
    private final long maxBytes;
    private final HostGuard guard;
    private final String userAgent;

    public FileDownloader(Path directory, int timeoutMs, long maxBytes, HostGuard guard, String userAgent) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
        this.timeoutMs = Math.max(1, timeoutMs);
        this.maxBytes = Math.max(1, maxBytes);
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.userAgent = userAgent == null ? "" : userAgent;
    }

    public static FileDownloader from(DownloadSettings settings, String userAgent) {
        return new FileDownloader(
                Path.of(settings.getDirectory()),
                settings.getTimeoutMs(),
                settings.getMaxBytes(),
                new HostGuard(settings.isAllowPrivateHosts()),
                userAgent
        );
    }

    /**
     * @param filename     target name, derived from the URL path when blank
     * @param subdirectory optional folder below the download directory
     * @param cookies      sent with every request, may be empty
     * @param referer      {@code Referer} header, {@code null} for none
     * @throws InvalidTaskException for blocked URLs and oversized bodies
     * @throws NavigationException  when the server cannot be reached or answers with an error status
     */
    public DownloadedFile download(String url, String filename, String subdirectory,
                                   Map<String, String> cookies, String referer) {
        Objects.requireNonNull(url, "url must not be null");
        Path target = targetPath(url, filename, subdirectory);
        Connection.Response response = fetch(url, cookies, referer);

        Path tmp = null;
        long size = 0;
        MessageDigest digest = sha256();
        try {
            Files.createDirectories(target.getParent());
            tmp = Files.createTempFile(target.getParent(), ".download-", ".part");
            byte[] buffer = new byte[64 * 1024];
            try (InputStream in = response.bodyStream(); OutputStream out = Files.newOutputStream(tmp)) {
                int n;
                while ((n = in.read(buffer)) != -1) {
                    size += n;
                    if (size > maxBytes) {
                        throw new InvalidTaskException("download of '" + url + "' exceeds downloads.max_bytes (" + maxBytes + ")");
                    }
                    digest.update(buffer, 0, n);
                    out.write(buffer, 0, n);
                }
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            tmp = null;
        } catch (IOException e) {
            throw new NavigationException(url, "download failed: " + e.getMessage(), e);
        } finally {
            deleteQuietly(tmp);
        }

        DownloadedFile file = new DownloadedFile(url, target.toString(), target.getFileName().toString(), size,
                HexFormat.of().formatHex(digest.digest()), response.contentType());
        logger.info("Downloaded {} to {} ({} bytes)", url, target, size);
        return file;
    }

    private Connection.Response fetch(String url, Map<String, String> cookies, String referer) {
        String current = url;
        for (int hop = 0; ; hop++) {
            guard.check(current);
            Connection connection = Jsoup.connect(current)
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .ignoreContentType(true)
                    .ignoreHttpErrors(true)
                    .followRedirects(false)
                    .maxBodySize(0)
                    .method(Connection.Method.GET);
            if (cookies != null && !cookies.isEmpty()) {
                connection.cookies(cookies);
            }
            if (referer != null && !referer.isBlank()) {
                connection.referrer(referer);
            }

            Connection.Response response;
            try {
                response = connection.execute();
            } catch (IOException | IllegalArgumentException e) {
                throw new NavigationException(current, String.valueOf(e.getMessage()), e);
            }
            int status = response.statusCode();
            String location = response.header("Location");
            if (status >= 300 && status < 400 && location != null) {
                if (hop >= MAX_REDIRECTS) {
                    throw new NavigationException(url, "more than " + MAX_REDIRECTS + " redirects");
                }
                response.bufferUp();
                current = resolve(current, location);
                logger.debug("Download of {} redirected to {}", url, current);
                continue;
            }
            if (status >= 400) {
                throw new NavigationException(current, "HTTP " + status);
            }
            return response;
        }
    }

    private static String resolve(String base, String location) {
        try {
            return URI.create(base).resolve(location.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new NavigationException(base, "invalid redirect target '" + location + "'", e);
        }
    }

    Path targetPath(String url, String filename, String subdirectory) {
        String name = filename == null || filename.isBlank() ? nameFromUrl(url) : filename;
        String folder = FileNames.sanitize(subdirectory, "");
        Path dir = folder.isEmpty() ? directory : directory.resolve(folder);
        return dir.resolve(FileNames.sanitize(name, FALLBACK_NAME));
    }

    /**
     * Last path segment of the URL, or {@code download-<hash>.bin} with a hash of the URL when the path has none.
     */
    static String nameFromUrl(String url) {
        String path = null;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            logger.debug("Cannot take a file name from {}: {}", url, e.getMessage());
        }
        if (path != null) {
            String last = path.substring(path.lastIndexOf('/') + 1);
            if (!last.isBlank()) {
                return last;
            }
        }
        byte[] hash = sha256().digest(url.getBytes(StandardCharsets.UTF_8));
        return "download-" + HexFormat.of().formatHex(hash).substring(0, 12) + ".bin";
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            logger.warn("Could not delete partial download {}: {}", tmp, e.getMessage());
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
