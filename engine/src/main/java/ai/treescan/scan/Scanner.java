package ai.treescan.scan;

import ai.treescan.finding.Diagnostic;
import ai.treescan.finding.Finding;
import ai.treescan.finding.FindingEmitter;
import ai.treescan.grammar.GrammarRegistry;
import ai.treescan.grammar.ParseException;
import ai.treescan.grammar.SyntaxTree;
import ai.treescan.grammar.UnsupportedLanguageException;
import ai.treescan.match.CandidateFilter;
import ai.treescan.match.MatcherEngine;
import ai.treescan.predicate.PredicateEvaluator;
import ai.treescan.util.ExecutorServiceUtil;
import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs query sets over source files. Each file is one task on a fixed worker pool: the task parses the file once,
 * evaluates every query registered for its language in order, and returns its findings and diagnostics. Results are
 * concatenated in input order, so a scan's output does not depend on scheduling.
 *
 * <p>Problems confined to one file become a {@link Diagnostic} for that file and the rest of the corpus is still
 * scanned. Internal faults such as {@link ai.treescan.predicate.MissingCaptureException} abort the scan.
 */
public final class Scanner implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(Scanner.class);

    /** Backtracks past bindings the pattern's predicates reject. */
    private static final CandidateFilter PREDICATES =
            (pattern, captures) -> PredicateEvaluator.accept(pattern.predicates(), captures);

    private final GrammarRegistry registry;
    private final ScanConfig config;
    private final ExecutorService executor;

    public Scanner(GrammarRegistry registry, ScanConfig config) {
        this.registry = registry;
        this.config = config;
        this.executor = ExecutorServiceUtil.newFixedThreadExecutor(
                config.parallelism(), "treescan-scan-", config.workerStackBytes());
    }

    public GrammarRegistry registry() {
        return registry;
    }

    public ScanConfig config() {
        return config;
    }

    /**
     * Scans {@code files} in parallel.
     *
     * @throws InterruptedException if interrupted while waiting for workers; remaining tasks are cancelled
     */
    public ScanResult scan(List<SourceFile> files, QuerySet queries) throws InterruptedException {
        logger.debug("Scanning {} file(s) with {} worker(s)", files.size(), config.parallelism());
        var futures = new ArrayList<Future<ScanResult>>(files.size());
        for (var file : files) {
            futures.add(executor.submit(() -> scanFile(file, queries)));
        }
        var findings = new ArrayList<Finding>();
        var diagnostics = new ArrayList<Diagnostic>();
        try {
            for (var future : futures) {
                var result = future.get();
                findings.addAll(result.findings());
                diagnostics.addAll(result.diagnostics());
            }
        } catch (ExecutionException e) {
            cancelAll(futures);
            var cause = e.getCause();
            logger.error("Scan aborted by internal fault", cause);
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException("Scan task failed", cause);
        } catch (InterruptedException e) {
            cancelAll(futures);
            throw e;
        }
        logger.debug("Scan produced {} finding(s) and {} diagnostic(s)", findings.size(), diagnostics.size());
        return new ScanResult(findings, diagnostics);
    }

    /**
     * Reads and scans files from disk. Files that are too large, unreadable or not UTF-8 are reported as
     * {@link Diagnostic.Kind#READ_ERROR}; those diagnostics come before the diagnostics of the scan itself.
     */
    public ScanResult scanPaths(Collection<Path> paths, QuerySet queries) throws InterruptedException {
        var files = new ArrayList<SourceFile>(paths.size());
        var readErrors = new ArrayList<Diagnostic>();
        for (var path : paths) {
            String name = path.toString();
            try {
                long size = Files.size(path);
                if (size > config.maxFileBytes()) {
                    logger.warn("Skipping {}: {} bytes exceeds the {} byte limit", name, size, config.maxFileBytes());
                    readErrors.add(Diagnostic.readError(
                            name, "File is " + size + " bytes, larger than the " + config.maxFileBytes() + " byte limit"));
                    continue;
                }
                files.add(SourceFile.read(path, registry));
            } catch (CharacterCodingException e) {
                logger.warn("Skipping {}: not valid UTF-8", name);
                readErrors.add(Diagnostic.readError(name, "File is not valid UTF-8"));
            } catch (IOException e) {
                logger.warn("Skipping {}: {}", name, e.getMessage());
                readErrors.add(Diagnostic.readError(name, "Cannot read file: " + e.getMessage()));
            }
        }
        var scanned = scan(files, queries);
        if (readErrors.isEmpty()) {
            return scanned;
        }
        readErrors.addAll(scanned.diagnostics());
        return new ScanResult(scanned.findings(), readErrors);
    }

    /** Scans one file on the calling thread. */
    public ScanResult scanFile(SourceFile file, QuerySet queries) {
        if (!registry.supports(file.languageId())) {
            logger.warn("Skipping {}: no grammar for language '{}'", file.path(), file.languageId());
            return ScanResult.of(Diagnostic.unsupportedLanguage(
                    file.path(), "No grammar registered for language '" + file.languageId() + "'"));
        }
        var languageQueries = queries.forLanguage(file.languageId());
        if (languageQueries.isEmpty()) {
            logger.debug("No queries for {}; skipping {}", file.languageId(), file.path());
            return ScanResult.EMPTY;
        }

        SyntaxTree tree;
        try {
            tree = registry.parse(file.languageId(), file.path(), file.text());
        } catch (UnsupportedLanguageException e) {
            return ScanResult.of(Diagnostic.unsupportedLanguage(file.path(), e.getMessage()));
        } catch (ParseException e) {
            logger.warn("Skipping {}: {}", file.path(), e.getMessage());
            return ScanResult.of(Diagnostic.parseError(file.path(), e.getSpan(), e.getMessage()));
        }

        var diagnostics = new ArrayList<Diagnostic>(1);
        if (tree.hasErrors()) {
            var errorSpan = tree.errorSpan().orElse(null);
            logger.warn("{} has syntax errors near {}; findings may be incomplete", file.path(), errorSpan);
            diagnostics.add(Diagnostic.parseError(
                    file.path(), errorSpan, "Syntax errors were recovered; findings may be incomplete"));
        }

        var findings = new ArrayList<Finding>();
        for (var query : languageQueries) {
            MatcherEngine.evaluate(query, tree, PREDICATES)
                    .map(captures -> FindingEmitter.emit(query, captures, file.path()))
                    .forEach(findings::add);
        }
        logger.debug("{}: {} finding(s) from {} node(s)", file.path(), findings.size(), tree.size());
        return new ScanResult(findings, diagnostics);
    }

    private static void cancelAll(List<Future<ScanResult>> futures) {
        for (var future : futures) {
            future.cancel(true);
        }
    }

    /** Abandons any tasks still queued or running. */
    @Override
    public void close() {
        executor.shutdownNow();
    }
}
