package guraa.sitephoto.service;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.model.FeatureSet;
import guraa.sitephoto.model.PairScore;
import guraa.sitephoto.model.Photo;
import guraa.sitephoto.visual.FeatureExtractor;
import guraa.sitephoto.visual.FeatureMatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Scores a single pair of stored photos outside of a report build.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FastMatchService {

    private final PhotoCatalog photoCatalog;
    private final FeatureExtractor featureExtractor;
    private final FeatureMatcher featureMatcher;
    private final MatchingSettings matchingSettings;

    /**
     * @param beforeId Store-relative id of the before photo
     * @param afterId Store-relative id of the after photo
     * @return Match count and normalised score of the pair
     * @throws IOException If either photo cannot be read or decoded
     */
    public PairScore scorePair(String beforeId, String afterId) throws IOException {
        Photo before = photoCatalog.findPhoto(beforeId);
        Photo after = photoCatalog.findPhoto(afterId);

        FeatureSet beforeFeatures = featureExtractor.extract(before.getId(),
                photoCatalog.readContent(before), matchingSettings);
        FeatureSet afterFeatures = featureExtractor.extract(after.getId(),
                photoCatalog.readContent(after), matchingSettings);

        int matches = featureMatcher.countConfirmedMatches(beforeFeatures, afterFeatures, matchingSettings.getRatio());
        double score = FeatureMatcher.normalize(matches, beforeFeatures.size(), afterFeatures.size());
        log.debug("Scored {} against {}: {} matches, score {}", beforeId, afterId, matches, score);

        return new PairScore(before.getId(), after.getId(),
                beforeFeatures.size(), afterFeatures.size(), matches, score);
    }
}
