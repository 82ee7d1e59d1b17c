package guraa.sitephoto.visual;

import guraa.sitephoto.config.MatchingSettings;
import guraa.sitephoto.exception.UnreadableImageException;
import guraa.sitephoto.model.FeatureSet;
import guraa.sitephoto.model.Keypoint;
import lombok.extern.slf4j.Slf4j;
import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.KeyPoint;
import org.opencv.core.Mat;
import org.opencv.core.MatOfByte;
import org.opencv.core.MatOfKeyPoint;
import org.opencv.core.Size;
import org.opencv.features2d.ORB;
import org.opencv.imgcodecs.Imgcodecs;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Extracts ORB keypoints and binary descriptors from encoded photos.
 * Large photos are downscaled first so the longer side equals {@code maxSide};
 * at most {@code maxFeatures} keypoints are kept, strongest response first.
 */
@Slf4j
@Component
public class FeatureExtractor {

    /**
     * ORB descriptors are 32 bytes (256 bits).
     */
    static final int DESCRIPTOR_BYTES = 32;

    /**
     * Extract features from an encoded image.
     *
     * @param photoId Identity of the photo, used in the result and in errors
     * @param encoded Encoded image bytes (JPEG, PNG, ...)
     * @param settings Feature cap and downscale bound
     * @return The feature set, possibly empty for a featureless image
     * @throws UnreadableImageException If the bytes cannot be decoded
     */
    public FeatureSet extract(String photoId, byte[] encoded, MatchingSettings settings)
            throws UnreadableImageException {
        if (encoded == null || encoded.length == 0) {
            throw new UnreadableImageException(photoId, "file is empty");
        }
        OpenCvLoader.ensureLoaded();

        MatOfByte buffer = null;
        Mat gray = null;
        Mat resized = null;
        Mat mask = null;
        MatOfKeyPoint keypoints = null;
        Mat descriptors = null;

        try {
            buffer = new MatOfByte(encoded);
            gray = Imgcodecs.imdecode(buffer, Imgcodecs.IMREAD_GRAYSCALE);
            if (gray == null || gray.empty()) {
                throw new UnreadableImageException(photoId, "not a decodable image");
            }

            Mat processed = gray;
            double scaleFactor = 1.0;
            int longerSide = Math.max(gray.cols(), gray.rows());
            if (longerSide > settings.getMaxSide()) {
                double scale = (double) settings.getMaxSide() / longerSide;
                Size target = gray.cols() >= gray.rows()
                        ? new Size(settings.getMaxSide(), Math.max(1, Math.round(gray.rows() * scale)))
                        : new Size(Math.max(1, Math.round(gray.cols() * scale)), settings.getMaxSide());
                resized = new Mat();
                Imgproc.resize(gray, resized, target, 0, 0, Imgproc.INTER_AREA);
                processed = resized;
                scaleFactor = (double) longerSide / settings.getMaxSide();
                log.debug("Downscaled {} from {}x{} to {}x{}", photoId, gray.cols(), gray.rows(),
                        resized.cols(), resized.rows());
            }

            ORB orb = ORB.create(settings.getMaxFeatures());
            keypoints = new MatOfKeyPoint();
            descriptors = new Mat();
            mask = new Mat();
            orb.detectAndCompute(processed, mask, keypoints, descriptors);

            FeatureSet features = toFeatureSet(photoId, keypoints.toArray(), descriptors,
                    settings.getMaxFeatures(), scaleFactor);
            log.debug("Extracted {} features from {}", features.size(), photoId);
            return features;
        } catch (CvException e) {
            throw new UnreadableImageException(photoId, e.getMessage(), e);
        } finally {
            release(buffer, gray, resized, mask, keypoints, descriptors);
        }
    }

    private FeatureSet toFeatureSet(String photoId, KeyPoint[] points, Mat descriptors, int cap, double scaleFactor) {
        if (points.length == 0 || descriptors.empty()) {
            return new FeatureSet(photoId, List.of(), new long[0][], scaleFactor);
        }
        if (descriptors.type() != CvType.CV_8UC1 || descriptors.cols() != DESCRIPTOR_BYTES
                || descriptors.rows() != points.length) {
            throw new IllegalStateException("Unexpected descriptor matrix " + descriptors + " for "
                    + points.length + " keypoints");
        }

        byte[] raw = new byte[descriptors.rows() * DESCRIPTOR_BYTES];
        descriptors.get(0, 0, raw);

        Integer[] order = new Integer[points.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        Arrays.sort(order, Comparator
                .comparingDouble((Integer i) -> -points[i].response)
                .thenComparingDouble(i -> points[i].pt.y)
                .thenComparingDouble(i -> points[i].pt.x));

        int kept = Math.min(cap, points.length);
        List<Keypoint> keypoints = new ArrayList<>(kept);
        long[][] packed = new long[kept][];
        for (int n = 0; n < kept; n++) {
            int i = order[n];
            KeyPoint point = points[i];
            keypoints.add(new Keypoint((float) point.pt.x, (float) point.pt.y, point.size, point.angle, point.response));
            packed[n] = pack(raw, i * DESCRIPTOR_BYTES);
        }
        return new FeatureSet(photoId, keypoints, packed, scaleFactor);
    }

    /**
     * Pack 32 descriptor bytes into four little-endian 64-bit words.
     */
    static long[] pack(byte[] raw, int offset) {
        long[] words = new long[FeatureSet.DESCRIPTOR_WORDS];
        for (int b = 0; b < DESCRIPTOR_BYTES; b++) {
            words[b / 8] |= (raw[offset + b] & 0xFFL) << (8 * (b % 8));
        }
        return words;
    }

    private static void release(Mat... mats) {
        for (Mat mat : mats) {
            if (mat != null) {
                mat.release();
            }
        }
    }
}
