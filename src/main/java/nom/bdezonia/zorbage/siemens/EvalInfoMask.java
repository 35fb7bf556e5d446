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

/**
 * The 64 bit evaluation info word that precedes the data of every scan. Most
 * of the bits are of no interest for spectroscopy; the ones that mark
 * auxiliary scans (feedback, sync, calibration) are broken out here.
 *
 * @author Barry DeZonia
 *
 */
public final class EvalInfoMask {

	public static final int ACQ_END = 0;
	public static final int RT_FEEDBACK = 1;
	public static final int HP_FEEDBACK = 2;
	public static final int SYNC_DATA = 5;
	public static final int RAW_DATA_CORRECTION = 10;
	public static final int REF_PHASE_STAB_SCAN = 14;
	public static final int PHASE_STAB_SCAN = 15;
	public static final int SIGN_REV = 17;
	public static final int PHASE_CORRECTION = 21;
	public static final int PAT_REF_SCAN = 22;
	public static final int PAT_REF_IMA_SCAN = 23;
	public static final int REFLECT = 24;
	public static final int NOISE_ADJ_SCAN = 25;

	private final long bits;

	public EvalInfoMask(long bits) {
		this.bits = bits;
	}

	public long bits() {
		return bits;
	}

	public boolean isSet(int bit) {
		return ((bits >>> bit) & 1) != 0;
	}

	public boolean acquisitionEnd() { return isSet(ACQ_END); }

	public boolean rtFeedback() { return isSet(RT_FEEDBACK); }

	public boolean hpFeedback() { return isSet(HP_FEEDBACK); }

	public boolean syncData() { return isSet(SYNC_DATA); }

	public boolean rawDataCorrection() { return isSet(RAW_DATA_CORRECTION); }

	public boolean refPhaseStabScan() { return isSet(REF_PHASE_STAB_SCAN); }

	public boolean phaseStabScan() { return isSet(PHASE_STAB_SCAN); }

	public boolean signReversal() { return isSet(SIGN_REV); }

	public boolean phaseCorrection() { return isSet(PHASE_CORRECTION); }

	public boolean patRefScan() { return isSet(PAT_REF_SCAN); }

	public boolean patRefImaScan() { return isSet(PAT_REF_IMA_SCAN); }

	public boolean reflect() { return isSet(REFLECT); }

	public boolean noiseAdjustScan() { return isSet(NOISE_ADJ_SCAN); }

	/**
	 * True for scans that carry no spectroscopy signal and must not reach the
	 * assembler. A PAT reference scan that is also flagged as an imaging scan
	 * still holds usable data and is kept.
	 */
	public boolean isSkipped() {
		return rtFeedback() || hpFeedback() || syncData() || noiseAdjustScan() ||
				phaseCorrection() || (patRefScan() && !patRefImaScan());
	}

	@Override
	public String toString() {
		return "EvalInfoMask[0x" + Long.toHexString(bits) + "]";
	}
}
