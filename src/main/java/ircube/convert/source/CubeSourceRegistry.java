package ircube.convert.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;

/**
 * Maps file extensions to {@link CubeSource} implementations.
 *
 * <h3>Resolution</h3>
 * <ul>
 *   <li>Extensions are matched case-insensitively against the text after the last dot of the file name</li>
 *   <li>When several sources claim one extension, the highest {@link CubeSource#getPriority()} wins;
 *       ties go to the source registered first</li>
 *   <li>Unknown extensions resolve to nothing; {@link #require(Path)} turns that into a {@link CubeParseException}</li>
 * </ul>
 *
 * <h3>Discovery</h3>
 * <p>{@link #withDefaults()} registers the built-in {@link EnviCubeSource} and every source
 * found by {@link ServiceLoader} on the classpath. Vendor readers for the FPA
 * {@code .dat}/{@code .seq}/{@code .dmt} formats are expected to arrive that way.</p>
 *
 * <p>Not thread-safe for registration; the converter registers everything up front and then
 * only performs lookups.</p>
 */
public final class CubeSourceRegistry {

    private static final Logger logger = LoggerFactory.getLogger(CubeSourceRegistry.class);

    private final Map<String, List<CubeSource>> sourcesByExtension = new LinkedHashMap<>();

    /**
     * Registry containing the built-in ENVI reader plus any {@link ServiceLoader} providers.
     */
    public static CubeSourceRegistry withDefaults() {
        CubeSourceRegistry registry = new CubeSourceRegistry();
        registry.register(new EnviCubeSource());
        for (CubeSource source : ServiceLoader.load(CubeSource.class)) {
            registry.register(source);
        }
        logger.info("Cube source registry initialised with extensions {}", registry.getExtensions());
        return registry;
    }

    /**
     * Registers a source for each of its extensions.
     *
     * @throws IllegalArgumentException if the source is null or declares no extensions
     */
    public void register(CubeSource source) {
        if (source == null) {
            throw new IllegalArgumentException("Cannot register a null cube source");
        }
        List<String> extensions = source.getExtensions();
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException(source.getClass().getSimpleName() + " declares no extensions");
        }
        for (String extension : extensions) {
            String normalized = normalizeExtension(extension);
            List<CubeSource> list = sourcesByExtension.computeIfAbsent(normalized, k -> new ArrayList<>());
            list.add(source);
            // stable sort keeps registration order among equal priorities
            list.sort((a, b) -> Integer.compare(b.getPriority(), a.getPriority()));
            logger.debug("Registered {} ({}) for '{}'", source.getClass().getSimpleName(),
                    source.getVariant().getDescription(), normalized);
        }
    }

    /**
     * Finds the preferred source for a file, based on its extension.
     */
    public Optional<CubeSource> find(Path path) {
        String extension = extensionOf(path);
        if (extension.isEmpty()) {
            return Optional.empty();
        }
        List<CubeSource> list = sourcesByExtension.get(extension);
        if (list == null || list.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(list.get(0));
    }

    /**
     * Like {@link #find(Path)} but fails when no source is registered.
     *
     * @throws CubeParseException if the extension is not supported
     */
    public CubeSource require(Path path) throws CubeParseException {
        return find(path).orElseThrow(() -> new CubeParseException(
                "No reader registered for '" + path.getFileName() + "' (supported: " + getExtensions() + ")"));
    }

    public boolean supports(Path path) {
        return find(path).isPresent();
    }

    /** Registered extensions in registration order. */
    public Set<String> getExtensions() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(sourcesByExtension.keySet()));
    }

    /**
     * Lowercase extension of the file name including the dot, or "" when there is none.
     */
    public static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Lowercases and trims an extension and ensures the leading dot.
     */
    public static String normalizeExtension(String extension) {
        if (extension == null || extension.trim().isEmpty()) {
            throw new IllegalArgumentException("Extension must not be empty");
        }
        String e = extension.trim().toLowerCase(Locale.ROOT);
        return e.startsWith(".") ? e : "." + e;
    }
}
