/**
 * The ext API associates arbitrary data with
 * instances of {@link io.github.eutro.mdsl2ir.ext.ExtContainer}.
 *
 * <pre>{@code
 * class Person extends ExtHolder { ... }
 *
 * class PersonExts {
 *   public static final Ext<String> NAME = Ext.create(String.class, "name");
 *   public static final Ext<Integer> AGE = Ext.create(Integer.class, "age");
 * }
 *
 * Person person = new Person();
 * person.attachExt(AGE, 33);
 * person.getExtOrThrow(AGE); // => 33
 * }</pre>
 * <p>
 * The IR uses exts for ownership links (which region an effect lives in,
 * which effect assigns a variable), for source locations and kernel hints
 * attached by the translator, and for static properties of operation keys
 * such as whether they terminate a region.
 * <p>
 * IR classes implement fast paths for their ownership exts by storing them
 * directly in fields.
 */
package io.github.eutro.mdsl2ir.ext;
