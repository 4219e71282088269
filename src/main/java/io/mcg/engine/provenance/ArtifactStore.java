package io.mcg.engine.provenance;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Out-of-band content referenced by an asset's {@code uri}. Two schemes are understood:
 *
 * <ul>
 *   <li>{@code mcg://bucket/key} stored as {@code <root>/bucket/key}</li>
 *   <li>{@code file:///absolute/path} stored at that path</li>
 * </ul>
 *
 * Writes are atomic and return the sha256 of the stored text, which callers record as the asset
 * {@code hash}.
 */
public final class ArtifactStore {
    private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

    public static final String SCHEME = "mcg";

    private final Path root;

    public ArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() {
        return root;
    }

    public static String uri(String bucket, String key) {
        return SCHEME + "://" + bucket + "/" + key;
    }

    public String write(String uri, String content) {
        Path target = resolve(uri);
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new LedgerException("Failed to write artifact " + uri + ": " + ex.getMessage(), ex);
        }
        LOG.debug("Stored {} chars at {}", content.length(), target);
        return AssetIds.sha256Hex(content);
    }

    public String read(String uri) {
        Path source = resolve(uri);
        try {
            return Files.readString(source, StandardCharsets.UTF_8);
        } catch (NoSuchFileException ex) {
            throw new LedgerException("Artifact not found: " + uri, ex);
        } catch (IOException ex) {
            throw new LedgerException("Failed to read artifact " + uri + ": " + ex.getMessage(), ex);
        }
    }

    /**
     * Content behind {@code asset.uri()}, checked against {@code asset.hash()} when the asset
     * carries one.
     */
    public String read(Asset asset) {
        String uri = asset.uriOptional()
            .orElseThrow(() -> new IllegalArgumentException("Asset " + asset.id() + " has no uri"));
        String content = read(uri);
        asset.hashOptional().ifPresent(expected -> {
            String actual = AssetIds.sha256Hex(content);
            if (!expected.equals(actual)) {
                throw new LedgerException("Artifact " + uri + " does not match hash of asset " + asset.id());
            }
        });
        return content;
    }

    Path resolve(String uri) {
        URI parsed;
        try {
            parsed = URI.create(uri);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Malformed artifact uri: " + uri, ex);
        }
        String scheme = parsed.getScheme() == null ? "" : parsed.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case SCHEME -> {
                String bucket = parsed.getAuthority();
                String key = parsed.getPath() == null ? "" : parsed.getPath().replaceFirst("^/+", "");
                if (bucket == null || bucket.isBlank() || key.isBlank()) {
                    throw new IllegalArgumentException("Artifact uri needs a bucket and a key: " + uri);
                }
                Path bucketDir = root.resolve(bucket).normalize();
                Path target = bucketDir.resolve(key).normalize();
                if (!bucketDir.startsWith(root) || !target.startsWith(bucketDir) || target.equals(bucketDir)) {
                    throw new IllegalArgumentException("Artifact uri escapes the store: " + uri);
                }
                return target;
            }
            case "file" -> {
                return Path.of(parsed).normalize();
            }
            default -> throw new IllegalArgumentException("Unsupported artifact uri scheme '" + scheme + "': " + uri);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOG.warn("Could not remove temporary artifact file {}: {}", temp, ex.getMessage());
        }
    }
}
