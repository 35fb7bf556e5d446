/*
 * zorbage-siemens: code for reading Siemens MR spectroscopy raw data into zorbage structures for further processing
 *
 * Copyright (C) 2024 Barry DeZonia
 * 
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 * 
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 * 
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package nom.bdezonia.zorbage.siemens;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import nom.bdezonia.zorbage.siemens.exceptions.MalformedContainerException;

/**
 * Decodes the Siemens CSA tag stream found in private DICOM elements.
 * <p>
 * Two layouts exist. CSA2 begins with "SV10", four unused bytes, then the tag
 * count and a delimiter (77); CSA1 starts directly with the count and the
 * delimiter. After that both hold the same tag records, but the item size
 * block is read differently.
 *
 * @author Barry DeZonia
 *
 */
public class CsaHeaderReader {

	/** Largest item overrun that is repaired rather than rejected. */
	public static final int DEFAULT_TRUNCATION_TOLERANCE = 1024;

	private static final int TAG_PREAMBLE = 84;

	private static final int ITEM_SIZE_BLOCK = 16;

	private static final Set<String> FLOATS = names(
			"NumberOfAverages", "RSatPositionSag", "PercentPhaseFieldOfView", "RSatOrientationSag", "MixingTime",
			"RSatPositionCor", "InversionTime", "RepetitionTime", "VoiThickness", "TransmitterReferenceAmplitude",
			"ImageOrientationPatient", "SliceThickness", "RSatOrientationTra", "PixelBandwidth", "SAR",
			"PixelSpacing", "ImagePositionPatient", "VoiPosition", "SliceLocation", "FlipAngle",
			"VoiInPlaneRotation", "VoiPhaseFoV", "SliceMeasurementDuration", "HammingFilterWidth",
			"RSatPositionTra", "MagneticFieldStrength", "VoiOrientation", "PercentSampling", "EchoTime",
			"VoiReadoutFoV", "RSatThickness", "RSatOrientationCor", "ImagingFrequency", "TriggerTime", "dBdt",
			"TransmitterCalibration", "PhaseGradientAmplitude", "ReadoutGradientAmplitude",
			"SelectionGradientAmplitude", "GradientDelayTime", "dBdt_max", "t_puls_max", "dBdt_thresh",
			"dBdt_limit", "SW_korr_faktor", "Stim_lim", "Stim_faktor");

	private static final Set<String> INTEGERS = names(
			"Rows", "Columns", "DataPointColumns", "SpectroscopyAcquisitionOut-of-planePhaseSteps",
			"EchoPartitionPosition", "AcquisitionMatrix", "NumberOfFrames", "EchoNumbers", "RealDwellTime",
			"EchoTrainLength", "EchoLinePosition", "EchoColumnPosition", "SpectroscopyAcquisitionDataColumns",
			"SpectroscopyAcquisitionPhaseColumns", "SpectroscopyAcquisitionPhaseRows", "RfWatchdogMask",
			"NumberOfPhaseEncodingSteps", "DataPointRows", "UsedPatientWeight", "NumberOfPrescans",
			"Stim_mon_mode", "Operation_mode_flag", "CoilId", "MiscSequenceParam", "MrProtocolVersion",
			"ProtocolSliceNumber");

	private static final Set<String> STRINGS = names(
			"ReferencedImageSequence", "ScanningSequence", "SequenceName", "ImagedNucleus", "TransmittingCoil",
			"PhaseEncodingDirection", "VariableFlipAngleFlag", "SequenceMask", "AcquisitionMatrixText",
			"MultistepIndex", "DataRepresentation", "SignalDomainColumns", "k-spaceFiltering", "ResonantNucleus",
			"ImaCoilString", "FrequencyCorrection", "WaterReferencedPhaseCorrection", "SequenceFileOwner",
			"CoilForGradient", "CoilForGradient2", "PositivePCSDirections");

	// do not instantiate

	private CsaHeaderReader() { }

	public static CsaHeader read(byte[] bytes) {
		return read(bytes, DEFAULT_TRUNCATION_TOLERANCE);
	}

	/**
	 *
	 * @param bytes the whole CSA block
	 * @param truncationTolerance items that overrun the block by at most this
	 *   many bytes are cut short and reported; larger overruns are fatal
	 * @return
	 */
	public static CsaHeader read(byte[] bytes, int truncationTolerance) {

		if (truncationTolerance < 0)
			throw new IllegalArgumentException("truncation tolerance cannot be negative");

		try (LittleEndianInput in = new LittleEndianInput(new ByteArrayInputStream(bytes))) {

			CsaHeader.Variant variant;

			if (bytes.length >= 4 && "SV10".equals(new String(bytes, 0, 4, StandardCharsets.ISO_8859_1))) {
				variant = CsaHeader.Variant.CSA2;
				// "SV10" and four unused bytes
				in.skip(8);
			}
			else {
				variant = CsaHeader.Variant.CSA1;
			}

			long numTags = in.readUnsignedInt();
			in.readUnsignedInt(); // delimiter

			if (numTags * TAG_PREAMBLE > bytes.length)
				throw new MalformedContainerException("CSA header claims "+numTags+" tags in "+bytes.length+" bytes");

			List<CsaTag> tags = new ArrayList<>();
			List<TagTruncation> truncations = new ArrayList<>();

			for (long t = 0; t < numTags; t++) {

				String name = text(in.readBytes(64));
				int vm = in.readInt();
				String vr = text(in.readBytes(4));
				int syngoDt = in.readInt();
				int numItems = in.readInt();
				in.readInt(); // delimiter

				if (numItems < 0 || (long) numItems * ITEM_SIZE_BLOCK > bytes.length - in.position())
					throw new MalformedContainerException("CSA tag "+name+" has an impossible item count "+numItems);

				List<Object> items = new ArrayList<>();

				for (int i = 0; i < numItems; i++) {

					long[] sizes = new long[4];
					for (int k = 0; k < 4; k++) {
						sizes[k] = in.readUnsignedInt();
					}

					long declared = variant == CsaHeader.Variant.CSA2 ? sizes[1] : sizes[0];
					long available = bytes.length - in.position();
					long length = declared;

					if (declared > available) {
						if (declared - available > truncationTolerance)
							throw new MalformedContainerException("CSA tag "+name+" item "+i+" overruns the header by "+
									(declared - available)+" bytes");
						TagTruncation truncation = new TagTruncation(name, i, declared, available);
						System.out.println("WARNING: CSA " + truncation);
						truncations.add(truncation);
						length = available;
					}

					String itemText = text(in.readBytes((int) length));

					if (length > 0) {
						Object item = coerce(name, vr, itemText);
						if (item != null)
							items.add(item);
					}

					// items are padded to the next 4 byte boundary
					long padding = (4 - (length % 4)) % 4;
					in.skip(Math.min(padding, bytes.length - in.position()));
				}

				tags.add(new CsaTag(name, vm, vr, syngoDt, items));
			}

			return new CsaHeader(variant, tags, truncations);

		} catch (IOException e) {
			throw new MalformedContainerException("could not read CSA header: "+e.getMessage(), e);
		}
	}

	/**
	 * Turn item text into the type its tag name calls for. Tags we have no
	 * type for keep their text. A numeric item with nothing but padding in it
	 * gives null.
	 */
	static Object coerce(String name, String vr, String item) {

		if ((FLOATS.contains(name) || INTEGERS.contains(name)) && item.trim().isEmpty())
			return null;

		if (FLOATS.contains(name)) {
			try {
				return Double.parseDouble(item.trim());
			} catch (NumberFormatException e) {
				throw new MalformedContainerException("CSA tag "+name+" holds a non numeric value: "+item, e);
			}
		}

		if (INTEGERS.contains(name)) {
			String trimmed = item.trim();
			try {
				return Long.parseLong(trimmed);
			} catch (NumberFormatException e) {
				try {
					double d = Double.parseDouble(trimmed);
					if (d == Math.rint(d))
						return (long) d;
				} catch (NumberFormatException e2) {
					e.addSuppressed(e2);
				}
				throw new MalformedContainerException("CSA tag "+name+" holds a non integer value: "+item, e);
			}
		}

		if (!STRINGS.contains(name))
			System.out.println("Unhandled CSA tag " + name + " with vr " + vr + " and value " + item);

		return item;
	}

	public static boolean isFloatTag(String name) {
		return FLOATS.contains(name);
	}

	public static boolean isIntegerTag(String name) {
		return INTEGERS.contains(name);
	}

	public static boolean isStringTag(String name) {
		return STRINGS.contains(name);
	}

	// everything up to the first NUL

	private static String text(byte[] bytes) {
		int len = 0;
		while (len < bytes.length && bytes[len] != 0)
			len++;
		return new String(bytes, 0, len, StandardCharsets.ISO_8859_1);
	}

	private static Set<String> names(String... names) {
		return Collections.unmodifiableSet(new HashSet<>(Arrays.asList(names)));
	}
}
