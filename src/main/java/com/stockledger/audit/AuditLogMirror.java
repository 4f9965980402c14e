package com.stockledger.audit;

import com.stockledger.dto.InventoryChange;
import com.stockledger.dto.PurchaseLine;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Mirrors inventory and purchase events into a git repository, one commit per
 * event.
 * <p>
 * The mirror is best-effort: it is called after the database write has been
 * committed and any failure here is logged and reported as {@code false},
 * never thrown back at the caller.
 */
public class AuditLogMirror implements AutoCloseable {

    private static final org.slf4j.Logger logger = org.slf4j.LoggerFactory.getLogger(AuditLogMirror.class);

    public static final String PURCHASE_TAG = "Purchase:";
    public static final String INVENTORY_TAG = "Inventory Update:";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String authorName;
    private final String authorEmail;
    private final String journalFile;
    private final Clock clock;

    private Git git;

    public AuditLogMirror(String authorName, String authorEmail, String journalFile, Clock clock) {
        this.authorName = authorName;
        this.authorEmail = authorEmail;
        this.journalFile = journalFile;
        this.clock = clock;
    }

    /**
     * Opens the git working directory at {@code path}, initializing a new
     * repository there when none exists.
     *
     * @return whether a repository is now available
     */
    public boolean ensureRepository(Path path) {
        close();
        try {
            Files.createDirectories(path);
            try {
                git = Git.open(path.toFile());
                logger.info("Opened audit repository at {}", path.toAbsolutePath());
            } catch (RepositoryNotFoundException e) {
                git = Git.init().setDirectory(path.toFile()).call();
                logger.info("Initialized new audit repository at {}", path.toAbsolutePath());
            }
            return true;
        } catch (IOException | GitAPIException e) {
            logger.error("Could not open audit repository at {}: {}", path, e.getMessage(), e);
            git = null;
            return false;
        }
    }

    public boolean isAvailable() {
        return git != null;
    }

    /**
     * Stages every change in the working directory, deletions included, and
     * commits when there is something to commit.
     *
     * @return whether a commit was created
     */
    public boolean commitAll(String message) {
        if (git == null) {
            logger.warn("Audit repository is not available, skipping commit");
            return false;
        }
        try {
            git.add().addFilepattern(".").call();
            git.add().addFilepattern(".").setUpdate(true).call();

            Status status = git.status().call();
            if (status.isClean()) {
                logger.info("No changes to commit");
                return false;
            }

            PersonIdent author = new PersonIdent(authorName, authorEmail);
            git.commit()
                    .setMessage(message)
                    .setAuthor(author)
                    .setCommitter(author)
                    .call();
            logger.info("Changes committed: {}", firstLine(message));
            return true;
        } catch (GitAPIException e) {
            logger.error("Error committing changes: {}", e.getMessage(), e);
            return false;
        }
    }

    public boolean recordPurchase(String customerName, List<PurchaseLine> lines) {
        StringBuilder message = new StringBuilder()
                .append(PURCHASE_TAG).append(' ').append(customerName)
                .append(" - ").append(now()).append("\n\n");
        for (PurchaseLine line : lines) {
            message.append("* ").append(line.productName())
                    .append(" x").append(line.quantity())
                    .append(" @ $").append(String.format(Locale.ROOT, "%.2f", line.price()))
                    .append('\n');
        }
        return record(message.toString());
    }

    public boolean recordInventoryChange(List<InventoryChange> changes) {
        StringBuilder message = new StringBuilder()
                .append(INVENTORY_TAG).append(' ').append(now()).append("\n\n");
        for (InventoryChange change : changes) {
            message.append("* ").append(change.productName())
                    .append(": ").append(change.oldQuantity())
                    .append(" -> ").append(change.newQuantity())
                    .append('\n');
        }
        return record(message.toString());
    }

    /**
     * Walks history from HEAD, newest first, collecting full commit messages
     * that start with {@code prefixTag}.
     *
     * @param limit maximum number of messages returned
     */
    public List<String> listEntries(String prefixTag, int limit) {
        List<String> entries = new ArrayList<>();
        if (git == null || limit <= 0) {
            return entries;
        }
        try {
            // Fresh repository without commits: nothing to walk
            if (git.getRepository().resolve(Constants.HEAD) == null) {
                return entries;
            }
            for (RevCommit commit : git.log().call()) {
                String message = commit.getFullMessage();
                if (message.startsWith(prefixTag)) {
                    entries.add(message);
                    if (entries.size() >= limit) {
                        break;
                    }
                }
            }
        } catch (IOException | GitAPIException e) {
            logger.error("Error reading audit history: {}", e.getMessage(), e);
        }
        return entries;
    }

    @Override
    public void close() {
        if (git != null) {
            git.close();
            git = null;
        }
    }

    // Each event is appended to the journal so the commit always has a change to carry
    private boolean record(String message) {
        if (git == null) {
            logger.warn("Audit repository is not available, event not recorded: {}", firstLine(message));
            return false;
        }
        Path journal = git.getRepository().getWorkTree().toPath().resolve(journalFile);
        try {
            Files.writeString(journal, message + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            logger.error("Could not write audit journal {}: {}", journal, e.getMessage(), e);
            return false;
        }
        return commitAll(message);
    }

    private String now() {
        return LocalDateTime.now(clock).format(TIMESTAMP);
    }

    private static String firstLine(String message) {
        int end = message.indexOf('\n');
        return end < 0 ? message : message.substring(0, end);
    }
}
