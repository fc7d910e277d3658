/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.spatial;

import java.nio.ByteOrder;

import io.pgspatial.data.geometry.Dimension;
import io.pgspatial.data.geometry.GeometryType;

/**
 * Helpers for the byte order marker and the type word of an EWKB geometry.
 *
 * @author pgspatial Authors
 */
public class GeometryUtil {

    /**
     * Checks whether the type word has the SRID flag encoded.
     *
     * @param wkbType the EWKB type word
     * @return {@code true} if an SRID follows the type word
     */
    public static boolean hasSrid(int wkbType) {
        return (wkbType & GeometryConstants.EWKB_SRID_FLAG) != 0;
    }

    /**
     * Returns the dimension declared by the Z and M flags of a type word.
     */
    public static Dimension getDimension(int wkbType) {
        return Dimension.fromFlags((wkbType & GeometryConstants.EWKB_Z_FLAG) != 0, (wkbType & GeometryConstants.EWKB_M_FLAG) != 0);
    }

    /**
     * Returns the base shape code of a type word with all extended flags cleared.
     */
    public static int getBaseType(int wkbType) {
        return wkbType & ~GeometryConstants.EWKB_FLAGS_MASK;
    }

    /**
     * Builds the EWKB type word for a shape.
     *
     * @param type the shape
     * @param dimension the dimension encoded in the Z and M flags
     * @param withSrid whether the SRID flag is set
     * @return the type word
     */
    public static int getTypeWord(GeometryType type, Dimension dimension, boolean withSrid) {
        int wkbType = type.getWkbCode();
        if (dimension.hasZDimension()) {
            wkbType |= GeometryConstants.EWKB_Z_FLAG;
        }
        if (dimension.isMeasured()) {
            wkbType |= GeometryConstants.EWKB_M_FLAG;
        }
        if (withSrid) {
            wkbType |= GeometryConstants.EWKB_SRID_FLAG;
        }
        return wkbType;
    }

    /**
     * Given the WKB byte order byte (0x00 or 0x01), returns the Java byte order.
     *
     * @param byteOrder the WKB byte order byte
     * @return the Java byte order
     * @throws MalformedWkbException if the byte is neither 0x00 nor 0x01
     */
    public static ByteOrder getByteOrder(byte byteOrder) {
        switch (byteOrder) {
            case GeometryConstants.LITTLE_BYTE_ORDER:
                return ByteOrder.LITTLE_ENDIAN;
            case GeometryConstants.BIG_BYTE_ORDER:
                return ByteOrder.BIG_ENDIAN;
            default:
                throw new MalformedWkbException("Invalid byte order marker: " + byteOrder);
        }
    }

    /**
     * Given a Java byte order, returns the mapped WKB byte order byte (0x00 or 0x01).
     *
     * @param byteOrder the Java byte order
     * @return the WKB byte order
     */
    public static byte getByteOrderByte(ByteOrder byteOrder) {
        return byteOrder == ByteOrder.LITTLE_ENDIAN
                ? GeometryConstants.LITTLE_BYTE_ORDER
                : GeometryConstants.BIG_BYTE_ORDER;
    }

    private GeometryUtil() {
    }
}
