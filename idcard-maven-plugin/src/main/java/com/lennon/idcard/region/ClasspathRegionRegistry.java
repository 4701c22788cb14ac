package com.lennon.idcard.region;

import com.lennon.idcard.spi.RandomSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Region table read once from a classpath resource.
 *
 * Format: one {@code code<TAB>name} per line, blank lines and lines starting with '#' ignored.
 * Codes must be 6 digits; duplicates are rejected.
 *
 * <p>The bundled {@value #DEFAULT_RESOURCE} is a sample of about 120 codes, not the full GB/T 2260
 * list: {@code lookup} is empty for most real numbers and unconstrained fakes draw from the sample
 * only. Put a complete table on the classpath and pass it to {@link #load(String)}.
 */
public final class ClasspathRegionRegistry implements RegionRegistry {
    private static final Logger log = LoggerFactory.getLogger(ClasspathRegionRegistry.class);

    public static final String DEFAULT_RESOURCE = "idcard/regions.tsv";

    private final Map<String, String> names;
    private final List<String> codes;

    ClasspathRegionRegistry(Map<String, String> names) {
        this.names = Collections.unmodifiableMap(new TreeMap<>(names));
        this.codes = Collections.unmodifiableList(new ArrayList<>(this.names.keySet()));
    }

    /** The bundled table, loaded on first use and shared. */
    public static ClasspathRegionRegistry bundled() {
        return Bundled.INSTANCE;
    }

    private static final class Bundled {
        static final ClasspathRegionRegistry INSTANCE = load();
    }

    public static ClasspathRegionRegistry load() {
        return load(DEFAULT_RESOURCE);
    }

    public static ClasspathRegionRegistry load(String resource) {
        ClassLoader cl = ClasspathRegionRegistry.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Region table not found on classpath: " + resource);
            }
            Map<String, String> parsed = parse(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)));
            log.debug("Loaded {} region codes from {}", parsed.size(), resource);
            return new ClasspathRegionRegistry(parsed);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read region table " + resource, e);
        }
    }

    static Map<String, String> parse(BufferedReader reader) throws IOException {
        Map<String, String> out = new TreeMap<>();
        String line;
        int lineNo = 0;
        while ((line = reader.readLine()) != null) {
            lineNo++;
            String s = line.trim();
            if (s.isEmpty() || s.startsWith("#")) continue;
            int tab = s.indexOf('\t');
            if (tab < 0) {
                throw new IllegalStateException("Line " + lineNo + ": expected code<TAB>name");
            }
            String code = s.substring(0, tab).trim();
            String name = s.substring(tab + 1).trim();
            if (!code.matches("\\d{6}") || name.isEmpty()) {
                throw new IllegalStateException("Line " + lineNo + ": bad region entry '" + s + "'");
            }
            if (out.put(code, name) != null) {
                throw new IllegalStateException("Line " + lineNo + ": duplicate region code " + code);
            }
        }
        return out;
    }

    @Override
    public Optional<String> lookup(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(names.get(code));
    }

    @Override
    public boolean contains(String code) {
        return code != null && names.containsKey(code);
    }

    @Override
    public String randomCode(RandomSource random) {
        return codes.get(random.nextInt(codes.size()));
    }

    @Override
    public Optional<String> randomCodeWithPrefix(String prefix, RandomSource random) {
        if (prefix == null || prefix.isEmpty()) return Optional.empty();
        List<String> matched = new ArrayList<>();
        for (String code : codes) {
            if (code.startsWith(prefix)) matched.add(code);
        }
        if (matched.isEmpty()) return Optional.empty();
        return Optional.of(matched.get(random.nextInt(matched.size())));
    }

    public int size() { return codes.size(); }
}
