package io.dazzleduck.sharing.table;

import io.dazzleduck.sharing.common.error.InternalException;

import java.net.URI;
import java.nio.file.Paths;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Resolution of log file paths against a table root.
 */
final class StoragePaths {

    private static final Pattern SCHEME = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*:.*");

    private StoragePaths() {
    }

    static URI root(String location) {
        URI uri = toUri(location);
        var text = uri.toString();
        return text.endsWith("/") ? uri : URI.create(text + "/");
    }

    /**
     * Resolves a file of the table rooted at {@code root}, rejecting files outside of it.
     */
    static URI resolve(URI root, String path) {
        URI file;
        try {
            file = SCHEME.matcher(path).matches() ? toUri(path) : root.resolve(URI.create(path));
            file = file.normalize();
            if ("file".equals(file.getScheme())) {
                // resolve() drops the empty authority of file:/// URIs
                file = Paths.get(file).toUri();
            }
        } catch (IllegalArgumentException e) {
            throw new InternalException("invalid file path in table log: " + path, e);
        }
        if (!Objects.equals(scheme(file), scheme(root))
                || !Objects.equals(file.getAuthority(), root.getAuthority())
                || file.getPath() == null
                || hasDotSegment(file.getPath())
                || !file.getPath().startsWith(root.getPath())) {
            throw new InternalException("file " + path + " is outside of table location " + root);
        }
        return file;
    }

    // normalize() only folds literal dot segments; percent-encoded ones show up once decoded
    private static boolean hasDotSegment(String path) {
        for (var segment : path.split("/")) {
            if (".".equals(segment) || "..".equals(segment)) {
                return true;
            }
        }
        return false;
    }

    private static URI toUri(String location) {
        if (SCHEME.matcher(location).matches() && !location.matches("^[a-zA-Z]:\\\\.*")) {
            var uri = URI.create(location);
            if ("file".equals(uri.getScheme())) {
                return Paths.get(uri).toUri();
            }
            return uri;
        }
        return Paths.get(location).toAbsolutePath().toUri();
    }

    private static String scheme(URI uri) {
        var scheme = uri.getScheme();
        if ("s3a".equals(scheme) || "s3n".equals(scheme)) {
            return "s3";
        }
        return scheme;
    }
}
