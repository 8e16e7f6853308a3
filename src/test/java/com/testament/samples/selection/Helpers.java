package com.testament.samples.selection;

/** Not a module: no test methods. */
public class Helpers {

    public static String greeting() {
        return "hello";
    }
}
