package com.project.coronal.tracking.service;

import com.project.coronal.tracking.model.Contour;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every identity the tracker has issued, indexed by id. Ids are dense: the n-th identity
 * issued is n, starting at 0, and records are never removed. With a positive
 * {@code maxIdleFrames} the last sighting of an identity that has not been seen for
 * that many frames is released, which bounds memory held by long runs while keeping
 * the record itself. Sightings must be reported in non-decreasing frame order.
 */
public class IdentityRegistry {
    private static final Logger log = LoggerFactory.getLogger(IdentityRegistry.class);

    private final List<IdentityRecord> records = new ArrayList<>();
    // unreleased records, least recently sighted first
    private final Map<Integer, IdentityRecord> live = new LinkedHashMap<>();
    private final int maxIdleFrames;

    public IdentityRegistry(int maxIdleFrames) {
        this.maxIdleFrames = maxIdleFrames;
    }

    /** Issues the next id to {@code contour}, sets its colour and records the sighting. */
    public IdentityRecord issue(Contour contour, Color color, long frame) {
        int id = records.size();
        contour.setId(id);
        contour.setColor(color);
        IdentityRecord record = new IdentityRecord(id, color, frame, contour);
        records.add(record);
        live.put(id, record);
        return record;
    }

    /** Records that an already issued identity was seen again. */
    public void sighted(Contour contour, long frame) {
        IdentityRecord record = get(contour.getId());
        record.sighted(frame, contour);
        live.remove(record.getId());
        live.put(record.getId(), record);
    }

    public IdentityRecord get(int id) {
        if (id < 0 || id >= records.size()) {
            throw new IllegalArgumentException("Unknown identity " + id + " (issued: " + records.size() + ")");
        }
        return records.get(id);
    }

    /** Releases sightings idle for more than the configured number of frames. */
    public int releaseIdle(long currentFrame) {
        if (maxIdleFrames == 0) {
            return 0;
        }
        int released = 0;
        Iterator<IdentityRecord> it = live.values().iterator();
        while (it.hasNext()) {
            IdentityRecord record = it.next();
            if (currentFrame - record.getLastSeenFrame() <= maxIdleFrames) {
                break;
            }
            record.release();
            it.remove();
            released++;
        }
        if (released > 0) {
            log.debug("Released {} idle identities at frame {}", released, currentFrame);
        }
        return released;
    }

    public int size() {
        return records.size();
    }

    /** Identities whose last sighting is still held. */
    public int liveCount() {
        return live.size();
    }

    public List<IdentityRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public void clear() {
        records.clear();
        live.clear();
    }
}
