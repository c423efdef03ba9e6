package com.pathwaygraph.cli;

import com.pathwaygraph.core.convert.PathwayNodeConverter;
import com.pathwaygraph.core.json.NodeListReader;
import com.pathwaygraph.core.json.PathwayImportException;
import com.pathwaygraph.core.json.PathwayJsonCodec;
import com.pathwaygraph.core.model.ClinicalPathway;
import com.pathwaygraph.core.model.NodeList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads command input files as node lists or structured pathways.
 */
final class NodeInput {

    private static final Logger log = LoggerFactory.getLogger(NodeInput.class);

    private NodeInput() {
    }

    /**
     * Reads a node list, or a pathway JSON flattened into one.
     *
     * @param file input file
     * @param pathwayJson whether the file holds a structured pathway
     * @return node list
     * @throws PathwayImportException if the file cannot be read or parsed
     */
    static NodeList readNodes(Path file, boolean pathwayJson) {
        if (pathwayJson) {
            ClinicalPathway pathway = readPathway(file);
            return PathwayNodeConverter.pathwayToNodes(pathway);
        }
        return new NodeListReader().read(file);
    }

    static ClinicalPathway readPathway(Path file) {
        log.debug("Reading pathway from: {}", file);
        return new PathwayJsonCodec().importPathway(readString(file));
    }

    static String readString(Path file) {
        try {
            return Files.readString(file);
        } catch (IOException e) {
            throw new PathwayImportException("Cannot read file: " + file, e);
        }
    }

    /**
     * Writes text to a file, creating parent directories.
     *
     * @param file target file
     * @param content text
     */
    static void writeString(Path file, String content) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file, e);
        }
    }
}
