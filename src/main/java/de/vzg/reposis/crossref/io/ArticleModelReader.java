package de.vzg.reposis.crossref.io;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import de.vzg.reposis.crossref.model.Article;

/**
 * Reads article snapshots from JSON. A file holds either one article object or an array of them.
 */
@Service
public class ArticleModelReader {

    private static final Logger log = LoggerFactory.getLogger(ArticleModelReader.class);

    private static final TypeReference<List<Article>> ARTICLE_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public ArticleModelReader() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public List<Article> read(Path inputPath) throws IOException {
        log.info("Reading article metadata from {}", inputPath);
        try (InputStream is = new BufferedInputStream(Files.newInputStream(inputPath))) {
            return read(is);
        }
    }

    public List<Article> read(InputStream is) throws IOException {
        JsonNode tree = objectMapper.readTree(is);
        if (tree == null || tree.isMissingNode() || tree.isNull()) {
            throw new IOException("No article metadata found");
        }
        List<Article> articles = tree.isArray()
            ? objectMapper.convertValue(tree, ARTICLE_LIST)
            : List.of(objectMapper.treeToValue(tree, Article.class));
        log.debug("Read {} article(s)", articles.size());
        return articles;
    }
}
