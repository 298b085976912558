package com.github.micycle1.surfrec;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.surfrec.io.FrameStore;
import com.github.micycle1.surfrec.store.MissingCoefficientMatrixException;

/**
 * Per-frame reconstruction and flattening.
 * <p>
 * Each operation writes its output only after it has fully succeeded, and does
 * nothing when the output already exists, so re-running a frame is safe.
 */
public class FrameProcessor {

	private static final Logger LOGGER = LoggerFactory.getLogger(FrameProcessor.class);

	public static final String HEIGHT = "z";
	public static final String CORRECTED_X = "gx";
	public static final String CORRECTED_Y = "gy";

	private final ReconstructionSettings settings;
	private final CompatibilitySolver solver;
	private final FrameStore gradients;
	private final FrameStore heights;
	private final FrameStore flattened;

	public FrameProcessor(ReconstructionSettings settings, CompatibilitySolver solver, FrameStore gradients, FrameStore heights,
			FrameStore flattened) {
		this.settings = settings;
		this.solver = solver;
		this.gradients = gradients;
		this.heights = heights;
		this.flattened = flattened;
	}

	/**
	 * Reads the measured gradients of {@code frame}, corrects them, integrates
	 * along the primary path and writes {@code z}, {@code gx}, {@code gy}.
	 *
	 * @return false if the output already existed and the frame was skipped
	 */
	public boolean reconstructFrame(int frame) throws IOException, MissingCoefficientMatrixException {
		final long t0 = System.nanoTime();
		final String out = heightName(frame);
		if (heights.exists(out, HEIGHT)) {
			LOGGER.info("Frame {} already reconstructed ({}), skipping", frame, out);
			return false;
		}

		GradientField measured = readMeasured(frame);
		GradientField corrected = solver.solve(measured);
		float[][] z = HeightIntegrator.reconstruct(corrected);
		heights.write(out, result(z, corrected));

		LOGGER.info("Reconstructed frame {} using {} sec", frame, String.format("%.2f", (System.nanoTime() - t0) / 1e9));
		return true;
	}

	/**
	 * Background gradient of an already reconstructed reference frame.
	 */
	public Flattening.Background backgroundOf(int referenceFrame) throws IOException {
		GradientField reference = readCorrected(referenceFrame);
		Flattening.Background bg = Flattening.estimateBackground(reference);
		LOGGER.info("Background from frame {}: {}", referenceFrame, bg);
		return bg;
	}

	/**
	 * Subtracts {@code background} from the corrected gradients of a
	 * reconstructed frame and integrates again; no new solve.
	 *
	 * @return false if the flattened output already existed
	 */
	public boolean flattenFrame(int frame, Flattening.Background background) throws IOException {
		final long t0 = System.nanoTime();
		final String out = flatName(frame);
		if (flattened.exists(out, HEIGHT)) {
			LOGGER.info("Frame {} already flattened ({}), skipping", frame, out);
			return false;
		}

		GradientField g = Flattening.subtract(readCorrected(frame), background);
		float[][] z = HeightIntegrator.reconstruct(g);
		flattened.write(out, result(z, g));

		LOGGER.info("Flattened frame {} using {} sec", frame, String.format("%.2f", (System.nanoTime() - t0) / 1e9));
		return true;
	}

	public GradientField readMeasured(int frame) throws IOException {
		Map<String, float[][]> arrays = gradients.read(gradientName(frame));
		return GradientField.fromArrays(arrays, settings.getGradientXDataset(), settings.getGradientYDataset());
	}

	public GradientField readCorrected(int frame) throws IOException {
		Map<String, float[][]> arrays = heights.read(heightName(frame));
		return GradientField.fromArrays(arrays, CORRECTED_X, CORRECTED_Y);
	}

	public String gradientName(int frame) {
		return String.format(settings.getGradientFilePattern(), frame);
	}

	public String heightName(int frame) {
		return String.format(settings.getHeightFilePattern(), frame);
	}

	public String flatName(int frame) {
		return String.format(settings.getFlatFilePattern(), frame);
	}

	private static Map<String, float[][]> result(float[][] z, GradientField g) {
		Map<String, float[][]> arrays = new LinkedHashMap<>();
		arrays.put(HEIGHT, z);
		arrays.put(CORRECTED_X, g.gx());
		arrays.put(CORRECTED_Y, g.gy());
		return arrays;
	}
}
