/*
 * Copyright (c) Facebook, Inc. and its affiliates.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.facebook.xcodegen.apple;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import java.util.Locale;
import java.util.Optional;

/** File types used in Apple targets. */
public final class FileTypes {

  // Utility class. Do not instantiate.
  private FileTypes() {}

  /** Map of file extension to Apple UTI (Uniform Type Identifier). Keys are lower case. */
  public static final ImmutableMap<String, String> FILE_EXTENSION_TO_UTI =
      ImmutableMap.<String, String>builder()
          .put("1", "text.man")
          .put("a", "archive.ar")
          .put("ada", "sourcecode.ada")
          .put("adb", "sourcecode.ada")
          .put("ads", "sourcecode.ada")
          .put("aiff", "audio.aiff")
          .put("api", "text.woapi")
          .put("app", "wrapper.application")
          .put("asdictionary", "archive.asdictionary")
          .put("asm", "sourcecode.asm.asm")
          .put("au", "audio.au")
          .put("avi", "video.avi")
          .put("bin", "archive.macbinary")
          .put("bmp", "image.bmp")
          .put("bundle", "wrapper.plug-in")
          .put("bzl", "com.google.bazel.skylark")
          .put("c", "sourcecode.c.c")
          .put("c++", "sourcecode.cpp.cpp")
          .put("cc", "sourcecode.cpp.cpp")
          .put("cdda", "audio.aiff")
          .put("ci", "sourcecode.glsl")
          .put("cikernel", "sourcecode.glsl")
          .put("cl", "sourcecode.opencl")
          .put("class", "compiled.javaclass")
          .put("classdescription", "text.plist.ibClassDescription")
          .put("classdescriptions", "text.plist.ibClassDescription")
          .put("cp", "sourcecode.cpp.cpp")
          .put("cpp", "sourcecode.cpp.cpp")
          .put("csh", "text.script.csh")
          .put("css", "text.css")
          .put("cxx", "sourcecode.cpp.cpp")
          .put("d", "sourcecode.dtrace")
          .put("d2wmodel", "text.plist.d2wmodel")
          .put("defs", "sourcecode.mig")
          .put("dict", "text.plist")
          .put("dsym", "wrapper.dsym")
          .put("dtd", "text.xml")
          .put("dylan", "sourcecode.dylan")
          .put("dylib", "compiled.mach-o.dylib")
          .put("ear", "archive.ear")
          .put("exp", "sourcecode.exports")
          .put("f", "sourcecode.fortran")
          .put("f77", "sourcecode.fortran.f77")
          .put("f90", "sourcecode.fortran.f90")
          .put("f95", "sourcecode.fortran.f90")
          .put("for", "sourcecode.fortran")
          .put("frag", "sourcecode.glsl")
          .put("framework", "wrapper.framework")
          .put("fsh", "sourcecode.glsl")
          .put("gif", "image.gif")
          .put("gmk", "sourcecode.make")
          .put("gz", "archive.gzip")
          .put("h", "sourcecode.c.h")
          .put("h++", "sourcecode.cpp.h")
          .put("hh", "sourcecode.cpp.h")
          .put("hp", "sourcecode.cpp.h")
          .put("hpp", "sourcecode.cpp.h")
          .put("hqx", "archive.binhex")
          .put("htm", "text.html")
          .put("html", "text.html")
          .put("htmld", "wrapper.htmld")
          .put("hxx", "sourcecode.cpp.h")
          .put("i", "sourcecode.c.c.preprocessed")
          .put("icns", "image.icns")
          .put("ico", "image.ico")
          .put("ii", "sourcecode.cpp.cpp.preprocessed")
          .put("inc", "sourcecode.pascal")
          .put("jam", "sourcecode.jam")
          .put("jar", "archive.jar")
          .put("java", "sourcecode.java")
          .put("javascript", "sourcecode.javascript")
          .put("jobs", "sourcecode.jobs")
          .put("jpeg", "image.jpeg")
          .put("jpg", "image.jpeg")
          .put("js", "sourcecode.javascript")
          .put("jscript", "sourcecode.javascript")
          .put("jsp", "text.html.other")
          .put("kext", "wrapper.kernel-extension")
          .put("l", "sourcecode.lex")
          .put("lid", "sourcecode.dylan")
          .put("ll", "sourcecode.asm.llvm")
          .put("llx", "sourcecode.asm.llvm")
          .put("lm", "sourcecode.lex")
          .put("lmm", "sourcecode.lex")
          .put("lp", "sourcecode.lex")
          .put("lpp", "sourcecode.lex")
          .put("lxx", "sourcecode.lex")
          .put("m", "sourcecode.c.objc")
          .put("mak", "sourcecode.make")
          .put("mi", "sourcecode.c.objc.preprocessed")
          .put("mid", "audio.midi")
          .put("midi", "audio.midi")
          .put("mig", "sourcecode.mig")
          .put("mii", "sourcecode.cpp.objcpp.preprocessed")
          .put("mm", "sourcecode.cpp.objcpp")
          .put("moov", "video.quicktime")
          .put("mov", "video.quicktime")
          .put("mp3", "audio.mp3")
          .put("mpeg", "video.mpeg")
          .put("mpg", "video.mpeg")
          .put("mpkg", "wrapper.installer-mpkg")
          .put("nasm", "sourcecode.nasm")
          .put("nib", "wrapper.nib")
          .put("nib~", "wrapper.nib")
          .put("nqc", "sourcecode.nqc")
          .put("o", "compiled.mach-o.objfile")
          .put("p", "sourcecode.pascal")
          .put("pas", "sourcecode.pascal")
          .put("pbfilespec", "text.plist.pbfilespec")
          .put("pblangspec", "text.plist.pblangspec")
          .put("pbxproj", "text.pbxproject")
          .put("pch", "sourcecode.c.h")
          .put("pch++", "sourcecode.cpp.h")
          .put("pct", "image.pict")
          .put("pdf", "image.pdf")
          .put("perl", "text.script.perl")
          .put("php", "text.script.php")
          .put("php3", "text.script.php")
          .put("php4", "text.script.php")
          .put("phtml", "text.script.php")
          .put("pict", "image.pict")
          .put("pkg", "wrapper.installer-pkg")
          .put("pl", "text.script.perl")
          .put("playground", "file.playground")
          .put("plist", "text.plist")
          .put("pm", "text.script.perl")
          .put("png", "image.png")
          .put("pp", "sourcecode.pascal")
          .put("ppob", "archive.ppob")
          .put("proto", "public.protobuf-source")
          .put("py", "text.script.python")
          .put("qtz", "video.quartz-composer")
          .put("r", "sourcecode.rez")
          .put("rb", "text.script.ruby")
          .put("rbw", "text.script.ruby")
          .put("rcx", "compiled.rcx")
          .put("rez", "sourcecode.rez")
          .put("rhtml", "text.html.other")
          .put("rsrc", "archive.rsrc")
          .put("rtf", "text.rtf")
          .put("rtfd", "wrapper.rtfd")
          .put("s", "sourcecode.asm")
          .put("sh", "text.script.sh")
          .put("shtml", "text.html.other")
          .put("sit", "archive.stuffit")
          .put("storyboard", "file.storyboard")
          .put("storyboardc", "wrapper.storyboardc")
          .put("strings", "text.plist.strings")
          .put("swift", "sourcecode.swift")
          .put("tar", "archive.tar")
          .put("tcc", "sourcecode.cpp.cpp")
          .put("tif", "image.tiff")
          .put("tiff", "image.tiff")
          .put("txt", "text")
          .put("vert", "sourcecode.glsl")
          .put("view", "archive.rsrc")
          .put("vsh", "sourcecode.glsl")
          .put("war", "archive.war")
          .put("wav", "audio.wav")
          .put("woa", "wrapper.application.webobjects")
          .put("wod", "text.wodefinitions")
          .put("woo", "text.plist.woobjects")
          .put("worksheet", "text.script.worksheet")
          .put("wos", "sourcecode.webscript")
          .put("xcclassmodel", "wrapper.xcclassmodel")
          .put("xcconfig", "text.xcconfig")
          .put("xcdatamodel", "wrapper.xcdatamodel")
          .put("xcdatamodeld", "wrapper.xcdatamodeld")
          .put("xclangspec", "text.plist.xclangspec")
          .put("xcmappingmodel", "wrapper.xcmappingmodel")
          .put("xcode", "wrapper.pb-project")
          .put("xcodeproj", "wrapper.pb-project")
          .put("xconf", "text.xml")
          .put("xcplaygroundpage", "file.xcplaygroundpage")
          .put("xcspec", "text.plist.xcspec")
          .put("xcsynspec", "text.plist.xcsynspec")
          .put("xctarget", "wrapper.pb-target")
          .put("xctxtmacro", "text.plist.xctxtmacro")
          .put("xhtml", "text.xml")
          .put("xib", "file.xib")
          .put("xmap", "text.xml")
          .put("xml", "text.xml")
          .put("xsl", "text.xml")
          .put("xslt", "text.xml")
          .put("xsp", "text.xml")
          .put("y", "sourcecode.yacc")
          .put("ym", "sourcecode.yacc")
          .put("ymm", "sourcecode.yacc")
          .put("yp", "sourcecode.yacc")
          .put("ypp", "sourcecode.yacc")
          .put("yxx", "sourcecode.yacc")
          .put("zip", "archive.zip")
          .build();

  /**
   * Map of directory extension to UTI, for directories that Xcode treats as a single opaque file
   * (bundles, asset catalogs, data models).
   */
  public static final ImmutableMap<String, String> DIR_EXTENSION_TO_UTI =
      ImmutableMap.<String, String>builder()
          .put("app", "wrapper.application")
          .put("appex", "wrapper.app-extension")
          .put("bundle", "wrapper.plug-in")
          .put("framework", "wrapper.framework")
          .put("octest", "wrapper.cfbundle")
          .put("xcassets", "folder.assetcatalog")
          .put("xcodeproj", "wrapper.pb-project")
          .put("xcdatamodel", "wrapper.xcdatamodel")
          .put("xcdatamodeld", "wrapper.xcdatamodeld")
          .put("xcmappingmodel", "wrapper.xcmappingmodel")
          .put("xctest", "wrapper.cfbundle")
          .put("xcstickers", "folder.stickers")
          .put("xpc", "wrapper.xpc-service")
          .build();

  /** Extensions of source files that are compiled as Swift. */
  public static final ImmutableSet<String> SWIFT_EXTENSIONS = ImmutableSet.of("swift");

  /** Returns the extension of the last path component, or empty if there is none. */
  public static Optional<String> getPathExtension(String path) {
    String lastComponent = getLastPathComponent(path);
    int dot = lastComponent.lastIndexOf('.');
    if (dot <= 0 || dot == lastComponent.length() - 1) {
      return Optional.empty();
    }
    return Optional.of(lastComponent.substring(dot + 1));
  }

  public static String getLastPathComponent(String path) {
    String trimmed = path;
    while (trimmed.length() > 1 && trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    int slash = trimmed.lastIndexOf('/');
    return slash < 0 ? trimmed : trimmed.substring(slash + 1);
  }

  /** Returns the Xcode UTI for the given path based on its extension. */
  public static Optional<String> getUniformTypeIdentifier(String path) {
    Optional<String> extension = getPathExtension(path);
    if (!extension.isPresent()) {
      return Optional.empty();
    }
    String lowerCaseExtension = extension.get().toLowerCase(Locale.US);
    String uti = FILE_EXTENSION_TO_UTI.get(lowerCaseExtension);
    if (uti == null) {
      uti = DIR_EXTENSION_TO_UTI.get(lowerCaseExtension);
    }
    return Optional.ofNullable(uti);
  }

  /** Returns the UTI if the given path component names a directory Xcode treats as a file. */
  public static Optional<String> getDirectoryUniformTypeIdentifier(String pathComponent) {
    return getPathExtension(pathComponent)
        .map(extension -> DIR_EXTENSION_TO_UTI.get(extension.toLowerCase(Locale.US)));
  }
}
