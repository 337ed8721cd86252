package com.pixelservices.invoke.components.fileserver;

import com.pixelservices.invoke.components.http.HttpContext;
import com.pixelservices.invoke.models.AssetHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Default asset fallback: serves a file under a root directory when no route matched.
 * Directory paths resolve to the configured index file if one exists.
 */
public class StaticAssetHandler implements AssetHandler {
    private static final Logger logger = LoggerFactory.getLogger(StaticAssetHandler.class);

    private final Path rootPath;
    private final String indexFile;

    /**
     * @param rootPath  the directory to serve from
     * @param indexFile the file served for directory paths, e.g. {@code index.html}
     */
    public StaticAssetHandler(Path rootPath, String indexFile) {
        this.rootPath = rootPath;
        this.indexFile = indexFile;
    }

    @Override
    public boolean serve(HttpContext ctx) {
        Path filePath = FileServerUtility.resolveUnderRoot(rootPath, ctx.path());
        if (filePath == null) {
            return true;
        }
        if (Files.isDirectory(filePath)) {
            if (indexFile == null || indexFile.isEmpty()) {
                return true;
            }
            filePath = filePath.resolve(indexFile);
        }
        if (!Files.isRegularFile(filePath)) {
            return true;
        }

        byte[] content;
        try {
            content = Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new UncheckedIOException("Error reading asset " + filePath, e);
        }
        ctx.response().status(200)
                .type(FileServerUtility.getContentType(filePath.getFileName().toString()))
                .body(content);
        logger.debug("Served asset {} for {}", filePath, ctx.path());
        return false;
    }

    public Path getRootPath() {
        return rootPath;
    }
}
