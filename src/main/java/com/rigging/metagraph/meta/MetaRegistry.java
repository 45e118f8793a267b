package com.rigging.metagraph.meta;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.rigging.metagraph.meta.rig.MetaFaceRig;
import com.rigging.metagraph.meta.rig.MetaRig;
import com.rigging.metagraph.meta.rig.MetaSubSystem;
import com.rigging.metagraph.meta.rig.MetaSupportSystem;

import lombok.extern.log4j.Log4j2;

/**
 * Registry mapping type tags to {@link MetaNode} subclasses and their
 * constructors.
 *
 * A tag is the simple class name, which is also the value written to the
 * {@code mClass} attribute of every meta node. Registration never replaces an
 * existing tag, so rescanning a search path is idempotent.
 *
 * Subclasses are discovered reflectively: any concrete subclass with a public
 * {@code (MetaFactory)} constructor qualifies.
 */
@Log4j2
public final class MetaRegistry {
    public static final String META_PATHS_ENV = "METAGRAPH_META_PATHS";

    /** A registered subtype and the function that instantiates it. */
    public record MetaType(String tag, Class<? extends MetaNode> type,
            Function<MetaFactory, ? extends MetaNode> constructor) {
    }

    private final Map<String, MetaType> types = new ConcurrentHashMap<>();
    // Kept open: classes loaded through them stay in use for the registry's lifetime.
    private final List<URLClassLoader> loaders = new CopyOnWriteArrayList<>();

    public MetaRegistry() {
    }

    /** A registry holding the subtypes that ship with the library. */
    public static MetaRegistry withBuiltIns() {
        MetaRegistry registry = new MetaRegistry();
        registry.register(MetaBase.class);
        registry.register(MetaScene.class);
        registry.register(MetaRig.class);
        registry.register(MetaSubSystem.class);
        registry.register(MetaSupportSystem.class);
        registry.register(MetaFaceRig.class);
        return registry;
    }

    public static String tagOf(Class<? extends MetaNode> type) {
        return type.getSimpleName();
    }

    // ── Registration ────────────────────────────────────────────────

    /**
     * Registers a subclass under its simple name.
     *
     * @return false when the tag is already taken.
     * @throws IllegalArgumentException when the class is abstract or has no
     *         public {@code (MetaFactory)} constructor.
     */
    public boolean register(Class<? extends MetaNode> type) {
        if (Modifier.isAbstract(type.getModifiers()))
            throw new IllegalArgumentException("Cannot register abstract meta type " + type.getName());
        Constructor<? extends MetaNode> ctor;
        try {
            ctor = type.getConstructor(MetaFactory.class);
        } catch (NoSuchMethodException e) {
            throw new IllegalArgumentException(type.getName() + " needs a public (MetaFactory) constructor", e);
        }
        return register(tagOf(type), type, factory -> instantiate(ctor, factory));
    }

    public boolean register(String tag, Class<? extends MetaNode> type,
            Function<MetaFactory, ? extends MetaNode> constructor) {
        MetaType previous = types.putIfAbsent(tag, new MetaType(tag, type, constructor));
        if (previous != null) {
            log.debug("Meta type '{}' already registered by {}", tag, previous.type().getName());
            return false;
        }
        log.debug("Registered meta type '{}' -> {}", tag, type.getName());
        return true;
    }

    private static MetaNode instantiate(Constructor<? extends MetaNode> ctor, MetaFactory factory) {
        try {
            return ctor.newInstance(factory);
        } catch (InvocationTargetException e) {
            if (e.getCause() instanceof RuntimeException)
                throw (RuntimeException) e.getCause();
            throw new IllegalStateException("Failed to construct " + ctor.getDeclaringClass().getName(), e.getCause());
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Failed to construct " + ctor.getDeclaringClass().getName(), e);
        }
    }

    // ── Lookup ──────────────────────────────────────────────────────

    public boolean isRegistered(String tag) {
        return tag != null && types.containsKey(tag);
    }

    public Optional<MetaType> type(String tag) {
        return tag == null ? Optional.empty() : Optional.ofNullable(types.get(tag));
    }

    public Set<String> tags() {
        return new TreeSet<>(types.keySet());
    }

    public int size() {
        return types.size();
    }

    // ── Search path scanning ────────────────────────────────────────

    /**
     * Registers the meta types found on the path list held by
     * {@value #META_PATHS_ENV}.
     *
     * @return the number of newly registered types; 0 when the variable is unset.
     */
    public int registerByEnv() {
        return registerByEnv(META_PATHS_ENV);
    }

    public int registerByEnv(String variable) {
        String value = System.getenv(variable);
        if (value == null || value.isBlank()) {
            log.debug("Environment variable {} is not set, no meta paths to scan", variable);
            return 0;
        }
        return registerPaths(splitSearchPath(value));
    }

    /** Splits a {@link File#pathSeparator} delimited list, dropping blanks. */
    public static List<Path> splitSearchPath(String value) {
        List<Path> out = new ArrayList<>();
        for (String part : value.split(File.pathSeparator)) {
            if (!part.isBlank())
                out.add(Path.of(part.trim()));
        }
        return out;
    }

    /**
     * Scans class directories and jars for meta types.
     *
     * @return the number of newly registered types.
     */
    public int registerPaths(List<Path> paths) {
        int registered = 0;
        for (Path path : paths) {
            if (Files.isDirectory(path)) {
                registered += registerDirectory(path);
            } else if (Files.isRegularFile(path) && path.toString().endsWith(".jar")) {
                registered += registerJar(path);
            } else {
                log.warn("Skipping meta search path {}: not a directory or jar", path);
            }
        }
        log.info("Scanned {} meta path(s), registered {} new type(s), {} total", paths.size(), registered,
                types.size());
        return registered;
    }

    private int registerDirectory(Path root) {
        List<String> classNames;
        try (Stream<Path> files = Files.walk(root)) {
            classNames = files.filter(p -> p.toString().endsWith(".class"))
                    .map(p -> toClassName(root.relativize(p).toString()))
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan " + root, e);
        }
        return registerClasses(root, classNames);
    }

    private int registerJar(Path jar) {
        List<String> classNames = new ArrayList<>();
        try (JarFile file = new JarFile(jar.toFile())) {
            Enumeration<JarEntry> entries = file.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                if (!entry.isDirectory() && entry.getName().endsWith(".class"))
                    classNames.add(toClassName(entry.getName()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + jar, e);
        }
        return registerClasses(jar, classNames);
    }

    static String toClassName(String relativePath) {
        String name = relativePath.substring(0, relativePath.length() - ".class".length());
        return name.replace('\\', '/').replace('/', '.');
    }

    private int registerClasses(Path location, List<String> classNames) {
        URLClassLoader loader;
        try {
            loader = new URLClassLoader(new URL[] { location.toUri().toURL() }, MetaNode.class.getClassLoader());
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Bad meta search path " + location, e);
        }
        loaders.add(loader);
        int registered = 0;
        for (String className : classNames) {
            if (className.endsWith("module-info") || className.endsWith("package-info")
                    || className.matches(".*\\$\\d+.*"))
                continue;
            Class<?> candidate;
            try {
                candidate = Class.forName(className, false, loader);
            } catch (ClassNotFoundException | LinkageError e) {
                log.debug("Could not load {} from {}: {}", className, location, e.toString());
                continue;
            }
            if (isMetaType(candidate) && register(candidate.asSubclass(MetaNode.class)))
                registered++;
        }
        return registered;
    }

    private static boolean isMetaType(Class<?> candidate) {
        if (!MetaNode.class.isAssignableFrom(candidate) || Modifier.isAbstract(candidate.getModifiers())
                || !Modifier.isPublic(candidate.getModifiers()))
            return false;
        try {
            candidate.getConstructor(MetaFactory.class);
            return true;
        } catch (NoSuchMethodException e) {
            log.debug("{} has no (MetaFactory) constructor, not registering", candidate.getName());
            return false;
        }
    }
}
