package com.project.coronal.tracking.DTOs;

import com.project.coronal.tracking.model.Frame;
import com.project.coronal.tracking.service.matching.ContourMatch;

import java.util.List;

/**
 * Outcome of ingesting one frame.
 *
 * @param frame          the ingested frame, every contour carrying an identity and features
 * @param matches        pairings with the previous frame that survived duplicate removal
 * @param newIdentities  identities issued for contours seen for the first time, ascending
 * @param frameNumber    1-based count of frames ingested so far
 */
public record TrackingResult(
        Frame frame,
        List<ContourMatch> matches,
        List<Integer> newIdentities,
        long frameNumber
) {}
