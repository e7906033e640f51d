package org.metricshub.tabby.toolchain;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Tabby
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import org.metricshub.tabby.util.TabbyLogger;
import org.slf4j.Logger;

/**
 * Copies the output of a child process to one of our streams, on its own thread.
 */
final class StreamPump extends Thread {

	private static final Logger LOG = TabbyLogger.getLogger(StreamPump.class);

	private final InputStream in;
	private final PrintStream out;

	private StreamPump(String name, InputStream in, PrintStream out) {
		super("pump:" + name);
		this.in = in;
		this.out = out;
		setDaemon(true);
	}

	/**
	 * Starts copying {@code in} to {@code out} until end of stream.
	 *
	 * @param name label of the stream, for the thread name
	 * @param in process output
	 * @param out destination
	 * @return the running pump
	 */
	static StreamPump dump(String name, InputStream in, PrintStream out) {
		StreamPump pump = new StreamPump(name, in, out);
		pump.start();
		return pump;
	}

	@Override
	public void run() {
		byte[] buffer = new byte[4096];
		try (InputStream source = in) {
			int len;
			while ((len = source.read(buffer)) >= 0) {
				out.write(buffer, 0, len);
			}
		} catch (IOException e) {
			LOG.debug("{} stopped: {}", getName(), e.getMessage());
		} finally {
			out.flush();
		}
	}
}
