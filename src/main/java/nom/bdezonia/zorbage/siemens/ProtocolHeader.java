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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import nom.bdezonia.zorbage.siemens.exceptions.DegenerateOrientationException;
import nom.bdezonia.zorbage.siemens.exceptions.MissingRequiredParameterException;

/**
 * Pulls acquisition parameters out of the ASCII protocol dump that TWIX files
 * carry at the front of each measurement. The dump holds both the ASCCONV
 * block (name = value lines) and XProtocol maps, and the spelling of each
 * parameter has changed between software versions, hence the pattern lists.
 *
 * @author Barry DeZonia
 *
 */
public class ProtocolHeader {

	public static final String PROTOCOL_NAME = "protocol_name";
	public static final String PATIENT_NAME = "patient_name";
	public static final String PATIENT_ID = "patient_id";
	public static final String PATIENT_BIRTHDATE = "patient_birthdate";
	public static final String FRAME_OF_REFERENCE = "frame_of_reference";
	public static final String SOFTWARE_VERSION = "software_version";
	public static final String MANUFACTURER = "manufacturer";
	public static final String MANUFACTURERS_MODEL_NAME = "manufacturers_model_name";
	public static final String SEQUENCE_NAME = "sequence_name";
	public static final String FREQUENCY = "f0";
	public static final String DWELL_TIME = "dt";
	public static final String TE = "te";
	public static final String TR = "tr";
	public static final String READOUT_FOV = "ro_fov";
	public static final String PHASE_FOV = "pe_fov";
	public static final String SLICE_THICKNESS = "slice_thickness";
	public static final String POSITION_SAG = "pos_sag";
	public static final String POSITION_COR = "pos_cor";
	public static final String POSITION_TRA = "pos_tra";
	public static final String NORMAL_SAG = "normal_sag";
	public static final String NORMAL_COR = "normal_cor";
	public static final String NORMAL_TRA = "normal_tra";
	public static final String IN_PLANE_ROTATION = "in_plane_rot";
	public static final String EXAM_DATE = "exam_date";
	public static final String EXAM_TIME = "exam_time";

	private static final String ASCCONV_NUMBER = "\\s*=\\s*(-?[0-9]*[.]?[0-9]*)";
	private static final String PRECISION_NUMBER = "\">  \\{ <Precision> \\d+(  -?[0-9\\.]+)?  \\}";
	private static final String PLAIN_NUMBER = "\">\\s*\\{\\s*(-?[0-9\\.]+)?\\s*\\}";

	private static final List<HeaderParameter> PARAMETERS = Collections.unmodifiableList(Arrays.asList(

		HeaderParameter.text(PROTOCOL_NAME, null,
				"tProtocolName\\s*=\\s*\"(.*)\"\\s*"),

		HeaderParameter.text(PATIENT_NAME, "",
				"<ParamString.\"PatientName\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n",
				"<ParamString.\"tPatientName\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(PATIENT_ID, "",
				"<ParamString.\"PatientID\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(PATIENT_BIRTHDATE, "",
				"<ParamString.\"PatientBirthDay\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(FRAME_OF_REFERENCE, "",
				"<ParamString.\"FrameOfReference\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(SOFTWARE_VERSION, "",
				"<ParamString.\"tMeasuredBaselineString\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n",
				"<ParamString.\"tBaselineString\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n",
				"<ParamString.\"SoftwareVersions\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(MANUFACTURER, "",
				"<ParamString.\"Manufacturer\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(MANUFACTURERS_MODEL_NAME, "",
				"<ParamString.\"ManufacturersModelName\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),
		HeaderParameter.text(SEQUENCE_NAME, "",
				"<ParamString.\"tSequenceFileName\">\\s*\\{\\s*\"(.+)\"\\s*\\}\\n"),

		// Hz -> MHz
		HeaderParameter.required(FREQUENCY, v -> v * 1e-6,
				"sTXSPEC\\.asNucleusInfo\\[0\\]\\.lFrequency\\s*=\\s*([0-9]*[.]?[0-9]*)",
				"<ParamLong.\"Frequency\">  \\{ (\\d*)  \\}",
				"<ParamDouble.\"MainFrequency\">\\s*\\{\\s*(?:<Precision> \\d+\\s+)?([0-9\\.]+)\\s*\\}"),

		// ns -> s
		HeaderParameter.required(DWELL_TIME, v -> v * 1e-9,
				"sRXSPEC\\.alDwellTime\\[0\\]\\s*=\\s*([0-9]*[.]?[0-9]*)",
				"<ParamLong.\"DwellTimeSig\">  \\{ (\\d*)  \\}",
				"<ParamDouble.\"DwellTime\">\\s*\\{\\s*(?:<Precision> \\d+\\s+)?([0-9\\.]+)\\s*\\}"),

		// us -> ms
		HeaderParameter.firstOf(TE, v -> v / 1000, "alTE\\[0\\]\\s*=\\s*(\\d+)"),
		HeaderParameter.firstOf(TR, v -> v / 1000, "alTR\\[0\\]\\s*=\\s*(\\d+)"),

		HeaderParameter.optional(READOUT_FOV, 0,
				"sSpecPara\\.sVoI\\.dReadoutFOV" + ASCCONV_NUMBER,
				"<ParamDouble.\"VoI_RoFOV" + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoI_RoFOV" + PLAIN_NUMBER),
		HeaderParameter.optional(PHASE_FOV, 0,
				"sSpecPara\\.sVoI\\.dPhaseFOV" + ASCCONV_NUMBER,
				"<ParamDouble.\"VoI_PeFOV" + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoI_PeFOV" + PLAIN_NUMBER),
		HeaderParameter.optional(SLICE_THICKNESS, 0,
				"sSpecPara\\.sVoI\\.dThickness" + ASCCONV_NUMBER,
				"<ParamDouble.\"VoI_SliceThickness" + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoI_SliceThickness" + PLAIN_NUMBER),

		position(POSITION_SAG, "Sag"),
		position(POSITION_COR, "Cor"),
		position(POSITION_TRA, "Tra"),

		HeaderParameter.optional(IN_PLANE_ROTATION, 0,
				"<ParamDouble\\.\"VoI_InPlaneRotAngle" + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoiInPlaneRot" + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoiInPlaneRot" + PLAIN_NUMBER,
				"<ParamDouble\\.\"VoI_InPlaneRotAngle" + PLAIN_NUMBER,
				"<ParamDouble\\.\"dInPlaneRot" + PLAIN_NUMBER),

		normal(NORMAL_SAG, "Sag"),
		normal(NORMAL_COR, "Cor"),
		normal(NORMAL_TRA, "Tra")
	));

	// do not instantiate

	private ProtocolHeader() { }

	public static List<HeaderParameter> parameters() {
		return PARAMETERS;
	}

	/**
	 * Extract every parameter. A header without usable voxel geometry yields no
	 * transform.
	 */
	public static HeaderParameters parse(String header) {
		return parse(header, false);
	}

	/**
	 *
	 * @param header the protocol text
	 * @param requireGeometry when true a degenerate orientation is an error
	 *   instead of a missing transform
	 * @return
	 */
	public static HeaderParameters parse(String header, boolean requireGeometry) {

		Map<String, Object> values = new LinkedHashMap<>();

		List<String> missing = new ArrayList<>();

		for (HeaderParameter parameter : PARAMETERS) {
			Object value = parameter.extract(header);
			if (value == null)
				missing.add(parameter.name());
			else
				values.put(parameter.name(), value);
		}

		if (!missing.isEmpty())
			throw new MissingRequiredParameterException(missing);

		String[] examDateTime = examDateTime((String) values.get(FRAME_OF_REFERENCE));
		values.put(EXAM_DATE, examDateTime[0]);
		values.put(EXAM_TIME, examDateTime[1]);

		AffineTransform transform;
		try {
			transform = transform(values);
		} catch (DegenerateOrientationException e) {
			if (requireGeometry)
				throw e;
			System.out.println("No voxel geometry in protocol header: " + e.getMessage());
			transform = null;
		}

		return new HeaderParameters(values, transform);
	}

	/**
	 * The exam date and time are buried in the frame of reference UID. An
	 * anonymized header has them replaced by x characters. A missing UID gives
	 * empty strings.
	 */
	static String[] examDateTime(String frameOfReference) {

		String anonymous = "xxxxxx";

		if (frameOfReference == null || frameOfReference.isEmpty())
			return new String[] { "", "" };

		if (frameOfReference.matches("x+"))
			return new String[] { anonymous, anonymous };

		String[] parts = frameOfReference.split("\\.");

		if (parts.length <= 10 || parts[10].length() < 14)
			return new String[] { "", "" };

		return new String[] { parts[10].substring(2, 8), parts[10].substring(8, 14) };
	}

	private static AffineTransform transform(Map<String, Object> values) {

		double[] normal = {
				(Double) values.get(NORMAL_SAG),
				(Double) values.get(NORMAL_COR),
				(Double) values.get(NORMAL_TRA) };

		double[] position = {
				(Double) values.get(POSITION_SAG),
				(Double) values.get(POSITION_COR),
				(Double) values.get(POSITION_TRA) };

		double[] spacing = {
				(Double) values.get(READOUT_FOV),
				(Double) values.get(PHASE_FOV),
				(Double) values.get(SLICE_THICKNESS) };

		return Orientation.transform(normal, (Double) values.get(IN_PLANE_ROTATION), position, spacing);
	}

	private static HeaderParameter position(String name, String axis) {
		return HeaderParameter.optional(name, 0,
				"sSpecPara\\.sVoI\\.sPosition\\.d" + axis + ASCCONV_NUMBER,
				"<ParamDouble\\.\"VoI_Position_" + axis + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoiPosition" + axis + PLAIN_NUMBER,
				"<ParamDouble\\.\"VoI_Position_" + axis + PLAIN_NUMBER,
				"<ParamDouble\\.\"VoiPosition" + axis + "\">  \\{ <Precision> \\d+ (-?[0-9\\.]+)? \\}",
				"<ParamMap\\.\"sVoI\">[\\s\\S]*?<ParamMap\\.\"sPosition\">[\\s\\S]*?<ParamDouble\\.\"d" + axis + "\">\\{ (-?[0-9\\.]+)?\\s?\\}");
	}

	private static HeaderParameter normal(String name, String axis) {
		return HeaderParameter.optional(name, 0,
				"sSpecPara\\.sVoI\\.sNormal\\.d" + axis + ASCCONV_NUMBER + "\\s*$",
				"<ParamDouble\\.\"VoI_Normal_" + axis + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoiNormal" + axis + PRECISION_NUMBER,
				"<ParamDouble\\.\"VoiNormal" + axis + PLAIN_NUMBER,
				"<ParamDouble\\.\"VoI_Normal_" + axis + PLAIN_NUMBER,
				"<ParamMap\\.\"sVoI\">[\\s\\S]*?<ParamMap\\.\"sNormal\">[\\s\\S]*?<ParamDouble\\.\"d" + axis + "\">\\{ (-?[0-9\\.]+)?\\s?\\}");
	}
}
