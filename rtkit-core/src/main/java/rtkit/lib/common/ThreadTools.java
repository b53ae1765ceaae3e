/*-
 * #%L
 * This file is part of RTKit.
 * %%
 * Copyright (C) 2024 RTKit developers
 * %%
 * RTKit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * RTKit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with RTKit.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package rtkit.lib.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Helpers for creating threads used by batch geometry operations.
 */
public class ThreadTools {
	
	/**
	 * Create a thread factory that names threads with a prefix followed by a counter.
	 * 
	 * @param prefix
	 * @param daemon if true, threads will not prevent the JVM from exiting
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		var counter = new AtomicInteger(1);
		return r -> {
			Thread t = new Thread(r, prefix + counter.getAndIncrement());
			t.setDaemon(daemon);
			return t;
		};
	}
	
}
