/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

/**
 * Constants of the PostGIS Extended Well-Known Binary (EWKB) encoding.
 *
 * @author pgspatial Authors
 */
final class GeometryConstants {

    // Extended WKB type word flags
    static final int EWKB_Z_FLAG = 0x80000000;
    static final int EWKB_M_FLAG = 0x40000000;
    static final int EWKB_SRID_FLAG = 0x20000000;

    static final int EWKB_FLAGS_MASK = EWKB_Z_FLAG | EWKB_M_FLAG | EWKB_SRID_FLAG;

    // Byte orders
    static final byte BIG_BYTE_ORDER = 0x00;
    static final byte LITTLE_BYTE_ORDER = 0x01;

    // Field sizes in bytes
    static final int BYTE_ORDER_SIZE = 1;
    static final int INT_SIZE = 4;
    static final int DOUBLE_SIZE = 8;
    static final int HEADER_SIZE = BYTE_ORDER_SIZE + INT_SIZE;

    private GeometryConstants() {
    }
}
