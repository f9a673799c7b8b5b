package com.aiaq.io;

import com.aiaq.model.BlockFactory;
import com.aiaq.model.Project;
import com.aiaq.model.Screen;
import com.aiaq.model.TypeCatalog;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Loads a project from an {@code .aia} archive or from a directory with the same layout.
 * <p>
 * Every {@code src/.../X.scm} becomes a screen, with its blocks read from the {@code X.bky} next to it. A missing
 * blocks file means no blocks, or an error in strict mode. {@code project.properties} and the names of
 * {@code assets/} entries are kept; anything else is logged and ignored.
 */
public class ProjectLoader {
    private static final Logger log = LoggerFactory.getLogger(ProjectLoader.class);

    private static final String FORM_SUFFIX = ".scm";
    private static final String BLOCKS_SUFFIX = ".bky";

    private final TypeCatalog catalog;
    private final boolean strict;
    private final FormReader formReader = new FormReader();
    private final BlocksReader blocksReader = new BlocksReader();

    public ProjectLoader() {
        this(TypeCatalog.standard(), false);
    }

    public ProjectLoader(TypeCatalog catalog, boolean strict) {
        this.catalog = catalog;
        this.strict = strict;
    }

    public Project load(Path path) throws IOException {
        if (Files.isDirectory(path)) {
            return loadDirectory(path);
        }
        if (Files.isRegularFile(path)) {
            return loadArchive(path);
        }
        throw new FileNotFoundException("No such project: " + path);
    }

    private Project loadArchive(Path path) throws IOException {
        try (ZipFile zip = new ZipFile(path.toFile())) {
            List<String> names = zip.stream()
                    .filter(entry -> !entry.isDirectory())
                    .map(ZipEntry::getName)
                    .collect(Collectors.toList());
            return assemble(projectName(path), names, name -> {
                ZipEntry entry = zip.getEntry(name);
                return entry == null ? null : zip.getInputStream(entry);
            });
        }
    }

    private Project loadDirectory(Path root) throws IOException {
        List<String> names;
        try (Stream<Path> files = Files.walk(root)) {
            names = files.filter(Files::isRegularFile)
                    .map(file -> root.relativize(file).toString().replace(File.separatorChar, '/'))
                    .sorted()
                    .collect(Collectors.toList());
        }
        return assemble(projectName(root), names, name -> {
            Path file = root.resolve(name);
            return Files.isRegularFile(file) ? Files.newInputStream(file) : null;
        });
    }

    private Project assemble(String defaultName, List<String> names, EntrySource source) throws IOException {
        Map<String, String> properties = Map.of();
        MutableList<String> assets = Lists.mutable.empty();
        MutableList<String> forms = Lists.mutable.empty();
        for (String name : names) {
            if (name.startsWith("assets/")) {
                assets.add(name);
            } else if (name.endsWith(FORM_SUFFIX)) {
                forms.add(name);
            } else if (name.endsWith(BLOCKS_SUFFIX)) {
                log.debug("Blocks file {} is read with its screen", name);
            } else if (name.endsWith("project.properties")) {
                properties = readProperties(source, name);
            } else {
                log.warn("Ignoring {} in project {}", name, defaultName);
            }
        }

        Project project = new Project(properties.getOrDefault("name", defaultName), properties, assets);
        AtomicInteger generatedIds = new AtomicInteger();
        for (String form : forms) {
            project.addScreen(loadScreen(source, form, generatedIds));
        }
        log.info("Loaded project {}: {} screens, {} components, {} blocks", project.name(),
                project.screens().size(), project.components().size(), project.blocks().size());
        return project;
    }

    private Screen loadScreen(EntrySource source, String formName, AtomicInteger generatedIds) throws IOException {
        String base = formName.substring(0, formName.length() - FORM_SUFFIX.length());
        FormDocument form;
        try (InputStream input = source.open(formName)) {
            form = formReader.read(input);
        }
        Screen screen = Screen.fromForm(form.form(), catalog);

        BlocksDocument blocks;
        try (InputStream input = source.open(base + BLOCKS_SUFFIX)) {
            if (input != null) {
                blocks = blocksReader.read(input);
            } else if (strict) {
                throw new FileNotFoundException("Did not find expected blocks file " + base + BLOCKS_SUFFIX);
            } else {
                log.warn("No blocks file for screen {}", screen.name());
                blocks = BlocksDocument.empty();
            }
        }
        screen.setVersions(max(form.yaVersion(), blocks.yaVersion()), blocks.languageVersion());
        new BlockFactory(screen, blocks.languageVersion(), generatedIds).build(blocks.blocks());
        log.debug("Read screen {} with {} blocks", screen.name(), screen.blocks().size());
        return screen;
    }

    private static Map<String, String> readProperties(EntrySource source, String name) throws IOException {
        Properties properties = new Properties();
        try (InputStream input = source.open(name)) {
            properties.load(input);
        }
        Map<String, String> sorted = new TreeMap<>();
        for (String key : properties.stringPropertyNames()) {
            sorted.put(key, properties.getProperty(key));
        }
        return sorted;
    }

    private static String projectName(Path path) {
        String fileName = path.getFileName() != null ? path.getFileName().toString() : path.toString();
        return fileName.endsWith(".aia") ? fileName.substring(0, fileName.length() - 4) : fileName;
    }

    private static Integer max(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        return b == null ? a : Math.max(a, b);
    }

    @FunctionalInterface
    private interface EntrySource {
        /** Opens an entry, or returns {@code null} if there is none with that name. */
        InputStream open(String name) throws IOException;
    }
}
