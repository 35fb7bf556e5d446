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

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;

import nom.bdezonia.zorbage.misc.DataBundle;

/**
 * Entry point for reading Siemens MR spectroscopy raw data (TWIX meas.dat
 * files) into zorbage structures.
 *
 * @author Barry DeZonia
 *
 */
public class SiemensReader {

	// do not instantiate

	private SiemensReader() { }

	/**
	 *
	 * @param filename
	 * @return
	 */
	public static

		DataBundle

			readAllDatasets(String filename)
	{
		try {

			URI uri = new URI("file", null, new File(filename).getAbsolutePath(), null);

			return readAllDatasets(uri);

		} catch (URISyntaxException e) {

			throw new IllegalArgumentException("Bad name for file: "+e.getMessage());
		}
	}

	/**
	 *
	 * @param fileURI
	 * @return
	 */
	public static

		DataBundle

			readAllDatasets(URI fileURI)
	{
		MrsData mrs = readTwix(fileURI);

		mrs.data().setSource(fileURI.toString());

		DataBundle bundle = new DataBundle();

		bundle.mergeComplexFlt64(mrs.data());

		return bundle;
	}

	/**
	 *
	 * @param fileURI
	 * @return
	 */
	public static

		MrsData

			readTwix(URI fileURI)
	{
		try (InputStream is = fileURI.toURL().openStream()) {

			return readTwix(is);

		} catch (IOException e) {

			throw new IllegalArgumentException("IOException during data read! "+e.getMessage(), e);
		}
	}

	/**
	 *
	 * @param stream
	 * @return
	 * @throws IOException
	 */
	public static

		MrsData

			readTwix(InputStream stream) throws IOException
	{
		return TwixReader.read(stream);
	}
}
