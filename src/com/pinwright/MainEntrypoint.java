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

package com.pinwright;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.pinwright.symbol.compare.CompareSymbolLibs;
import com.pinwright.symbol.merge.MergeSymbolLibs;
import com.pinwright.tools.SymbolLibGenerator;
import com.pinwright.tools.SymbolLibToCSV;
import com.pinwright.util.StringTools;

public class MainEntrypoint {
    interface MainStyleFunction<E extends Throwable> {
        void main(String[] args) throws E;
    }

    private static final Map<String, MainStyleFunction<?>> functions = new HashMap<>();
    private static final List<String> functionNames = new ArrayList<>();

    private static void addFunction(String name, MainStyleFunction<?> func) {
        functions.put(name.toLowerCase(), func);
        functionNames.add(name);
    }

    static {
        addFunction("CompareSymbolLibs", CompareSymbolLibs::main);
        addFunction("MergeSymbolLibs", MergeSymbolLibs::main);
        addFunction("SymbolLibGenerator", SymbolLibGenerator::main);
        addFunction("SymbolLibToCSV", SymbolLibToCSV::main);
    }

    static List<String> getApplicationNames() {
        return functionNames;
    }

    static boolean hasApplication(String name) {
        return functions.containsKey(name.toLowerCase());
    }

    private static void listModes(PrintStream ps) {
        StringTools.printListInColumns(functionNames, ps, 5);
    }

    public static void main(String[] args) throws Throwable {
        if (args.length == 0) {
            System.err.println("Need one argument to determine the application. Valid applications are (case-insensitive):");
            listModes(System.err);
            System.exit(1);
        }

        if (args.length >= 1 && args[0].equals("--list-apps")) {
            System.out.println("Current list of available PinWright applications (case-insensitive):");
            listModes(System.out);
            return;
        }

        String application = args[0];
        MainStyleFunction<?> func = functions.get(application.toLowerCase());
        if (func == null) {
            System.err.println("Invalid application '"+application+"'. Valid applications are (case-insensitive): ");
            listModes(System.err);
            System.exit(1);
        }

        String[] childArgs = new String[args.length-1];
        System.arraycopy(args, 1, childArgs, 0, args.length-1);
        func.main(childArgs);
    }
}
