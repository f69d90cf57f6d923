package com.github.musiKk.minic;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

import com.github.musiKk.minic.codegen.CodeGenerator;

/**
 * Reads {@value #CONFIG_FILE} from the working directory. Every key is
 * optional and a missing file means all defaults.
 */
public class ConfigReader {

    static final String CONFIG_FILE = "minic.cfg";

    static Config readConfig() {
        return readConfig(Path.of(CONFIG_FILE));
    }

    static Config readConfig(Path path) {
        var config = new Config();
        if (!Files.exists(path)) {
            return config;
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(path)) {
            properties.load(reader);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + path, e);
        }

        var lookupPath = properties.getProperty("lookupPath");
        if (lookupPath != null) {
            config.lookupPath.clear();
            Arrays.stream(lookupPath.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .forEach(config.lookupPath::add);
        }
        config.target = properties.getProperty("target", config.target).trim();
        config.assemblyName = properties.getProperty("assemblyName", config.assemblyName).trim();
        return config;
    }

    static class Config {
        List<String> lookupPath = new ArrayList<>(List.of("."));
        String target = "target/il";
        String assemblyName = CodeGenerator.DEFAULT_ASSEMBLY_NAME;

        public void applyConfig(ConfigTarget ct) {
            ct.setLookupPath(lookupPath);
            ct.setTarget(target);
            ct.setAssemblyName(assemblyName);
        }
    }

    interface ConfigTarget {
        void setLookupPath(List<String> lookupPath);
        void setTarget(String target);
        void setAssemblyName(String assemblyName);
    }

}
