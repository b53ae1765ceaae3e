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

/**
 * Simple 2D pixel grids used as the pixel payload of an image.
 */
package rtkit.lib.analysis.images;
