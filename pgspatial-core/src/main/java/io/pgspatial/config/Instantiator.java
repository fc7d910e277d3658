/*
 * Copyright pgspatial Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.pgspatial.config;

import java.lang.reflect.InvocationTargetException;

/**
 * Instantiates configured classes reflectively.
 *
 * @author pgspatial Authors
 */
public class Instantiator {

    public static ClassLoader getClassLoader() {
        ClassLoader classloader = Thread.currentThread().getContextClassLoader();
        if (classloader == null) {
            classloader = Instantiator.class.getClassLoader();
        }

        return classloader;
    }

    /**
     * Instantiates the specified class using its no-args constructor and checks it against the expected type.
     *
     * @param className the fully qualified class name
     * @param expectedType the type the instance must be assignable to
     * @return the newly created instance or {@code null} if no class name was given
     * @throws IllegalArgumentException if the class cannot be loaded, instantiated, or is not of the expected type
     */
    public static <T> T getInstance(String className, Class<T> expectedType) {
        if (className == null) {
            return null;
        }

        final Class<?> clazz;
        try {
            clazz = getClassLoader().loadClass(className);
        }
        catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Unable to find class " + className, e);
        }

        if (!expectedType.isAssignableFrom(clazz)) {
            throw new IllegalArgumentException("Class " + className + " is not a " + expectedType.getName());
        }

        try {
            return expectedType.cast(clazz.getDeclaredConstructor().newInstance());
        }
        catch (InstantiationException e) {
            throw new IllegalArgumentException("Unable to instantiate class " + className, e);
        }
        catch (IllegalAccessException e) {
            throw new IllegalArgumentException("Unable to access class " + className, e);
        }
        catch (IllegalArgumentException | InvocationTargetException | NoSuchMethodException | SecurityException e) {
            throw new IllegalArgumentException("Call to constructor of class " + className + " failed", e);
        }
    }
}
