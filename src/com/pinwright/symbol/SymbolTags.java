/*
 * Copyright (c) 2025, PinWright Contributors.
 * All rights reserved.
 *
 * This file is part of PinWright.
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
 *
 */

package com.pinwright.symbol;

/**
 * Tags of the lists that make up symbol library files.
 */
public class SymbolTags {

    public static final String KICAD_SYMBOL_LIB = "kicad_symbol_lib";
    public static final String VERSION = "version";
    public static final String GENERATOR = "generator";
    public static final String GENERATOR_VERSION = "generator_version";
    public static final String SYMBOL = "symbol";
    public static final String EXTENDS = "extends";
    public static final String PROPERTY = "property";
    public static final String PIN_NUMBERS = "pin_numbers";
    public static final String PIN_NAMES = "pin_names";
    public static final String EXCLUDE_FROM_SIM = "exclude_from_sim";
    public static final String IN_BOM = "in_bom";
    public static final String ON_BOARD = "on_board";
    public static final String EMBEDDED_FONTS = "embedded_fonts";
    public static final String UNIT_NAME = "unit_name";
    public static final String RECTANGLE = "rectangle";
    public static final String START = "start";
    public static final String END = "end";
    public static final String STROKE = "stroke";
    public static final String WIDTH = "width";
    public static final String TYPE = "type";
    public static final String FILL = "fill";
    public static final String COLOR = "color";
    public static final String PIN = "pin";
    public static final String AT = "at";
    public static final String LENGTH = "length";
    public static final String HIDE = "hide";
    public static final String NAME = "name";
    public static final String NUMBER = "number";
    public static final String ALTERNATE = "alternate";
    public static final String EFFECTS = "effects";
    public static final String FONT = "font";
    public static final String SIZE = "size";
    public static final String JUSTIFY = "justify";
    public static final String TEXT = "text";

    public static final String YES = "yes";
    public static final String NO = "no";
}
