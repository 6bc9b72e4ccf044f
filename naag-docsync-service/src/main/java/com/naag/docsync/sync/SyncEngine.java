package com.naag.docsync.sync;

import com.naag.docsync.domain.DomainDefinition;
import com.naag.docsync.domain.RecordMapper;
import com.naag.docsync.source.RemoteFile;
import com.naag.docsync.source.RemoteSourceClient;
import com.naag.docsync.store.HybridVectorStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lists candidate files for a domain and decides, per file, whether it needs processing.
 */
@Slf4j
public class SyncEngine {

    private final RemoteSourceClient source;
    private final HybridVectorStore store;
    private final ChangeDetector changeDetector;
    private final ZoneId zone;
    private final Clock clock;

    public SyncEngine(RemoteSourceClient source, HybridVectorStore store, ChangeDetector changeDetector,
                      ZoneId zone, Clock clock) {
        this.source = source;
        this.store = store;
        this.changeDetector = changeDetector;
        this.zone = zone;
        this.clock = clock;
    }

    /**
     * Lists every file in the domain folder with a supported extension that was modified after
     * {@code since}, or today when {@code since} is empty. Listing failures propagate.
     */
    public List<RemoteFile> listChanged(DomainDefinition domain, Optional<Instant> since) {
        List<RemoteFile> all = source.listAll(domain.folderPath());
        List<RemoteFile> candidates = new ArrayList<>();
        LocalDate today = LocalDate.now(clock.withZone(zone));
        int unparseable = 0;

        for (RemoteFile file : all) {
            if (!domain.accepts(file)) continue;
            Instant modified;
            try {
                modified = file.modifiedAt();
            } catch (DateTimeParseException e) {
                // kept so the diff step records it as an error instead of silently dropping it
                unparseable++;
                candidates.add(file);
                continue;
            }
            boolean include = since
                    .map(s -> modified.isAfter(s))
                    .orElseGet(() -> modified.atZone(zone).toLocalDate().equals(today));
            if (include) candidates.add(file);
        }

        log.info("Listed {} files in {}, {} candidates{} (since={})", all.size(), domain.folderPath(),
                candidates.size(), unparseable > 0 ? ", " + unparseable + " with bad timestamps" : "",
                since.map(Instant::toString).orElse("today"));
        return candidates;
    }

    /**
     * Check-before-download: one store lookup per file. Lookup failures propagate to the caller,
     * which records them against the file.
     */
    public SyncDecision decide(DomainDefinition domain, RecordMapper mapper, RemoteFile file) {
        Optional<String> lookupId = mapper.lookupId(file);
        Optional<String> stored = lookupId.isPresent()
                ? store.getLastModified(domain.collection(), lookupId.get())
                : store.getLastModifiedBySource(domain.collection(), file.id());

        boolean changed = changeDetector.isChanged(file.lastModified(), stored);
        return new SyncDecision(file, changed ? SyncDecision.Action.PROCESS : SyncDecision.Action.SKIP,
                stored.orElse(null));
    }
}
