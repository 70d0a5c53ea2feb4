/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.lzw.app;

import java.util.HashMap;
import java.util.Map;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.Error;
import io.github.flanglet.lzw.codec.LZWDecoder;



/**
 * The {@code LZW} class is a command-line application decompressing raw
 * GIF/TIFF style LZW code streams.
 */
public class LZW
{
   private static final String[] CMD_LINE_ARGS = new String[]
   {
      "-i", "-o", "-b", "-e", "-v", "-f", "-h"
   };

   private static final int ARG_IDX_INPUT = 0;
   private static final int ARG_IDX_OUTPUT = 1;
   private static final int ARG_IDX_CODE_SIZE = 2;
   private static final int ARG_IDX_BIT_ORDER = 3;
   private static final int ARG_IDX_VERBOSE = 4;

   private static final String LZW_VERSION = "1.0.0";
   private static final String APP_HEADER = "LZW " + LZW_VERSION + " (c) Frederic Langlet";
   private static final String APP_SUB_HEADER = "Variable width LZW decompressor (GIF/TIFF code streams).";
   private static final String APP_USAGE = "Usage: java -jar lzw.jar [flags and files in any order]";


   public static void main(String[] args)
   {
      Map<String, Object> map = new HashMap<>();
      int status = processCommandLine(args, map);

      // Command line processing error ?
      if (status != 0)
         System.exit(status);

      // Help mode only ?
      if (map.containsKey("inputName") == false)
         System.exit(0);

      FileDecompressor fd = null;

      try
      {
         fd = new FileDecompressor(map);
      }
      catch (Exception e)
      {
         System.err.println("Could not create the decompressor: "+e.getMessage());
         System.exit(Error.ERR_CREATE_DECOMPRESSOR);
      }

      System.exit(fd.call());
   }


   /**
    * Parses the command line into the option map consumed by
    * {@link FileDecompressor}.
    *
    * @param args the command line arguments
    * @param map receives the options
    * @return 0, or an error code if an option is invalid
    */
   public static int processCommandLine(String[] args, Map<String, Object> map)
   {
      int verbose = 1;
      int codeSize = 8;
      BitOrder order = BitOrder.LITTLE_ENDIAN;
      boolean overwrite = false;
      boolean showHelp = false;
      String inputName = "";
      String outputName = "";
      int ctx = -1;

      for (String arg : args)
      {
         arg = arg.trim();

         if (arg.equals("--help") || arg.equals("-h"))
         {
            showHelp = true;
            ctx = -1;
            continue;
         }

         if (arg.equals("--force") || arg.equals("-f"))
         {
            if (ctx != -1)
               printWarning(CMD_LINE_ARGS[ctx], " with no value.", verbose);

            overwrite = true;
            ctx = -1;
            continue;
         }

         String value = null;

         if (ctx == -1)
         {
            if (arg.startsWith("--input="))
            {
               ctx = ARG_IDX_INPUT;
               value = arg.substring(8);
            }
            else if (arg.startsWith("--output="))
            {
               ctx = ARG_IDX_OUTPUT;
               value = arg.substring(9);
            }
            else if (arg.startsWith("--code-size="))
            {
               ctx = ARG_IDX_CODE_SIZE;
               value = arg.substring(12);
            }
            else if (arg.startsWith("--bit-order="))
            {
               ctx = ARG_IDX_BIT_ORDER;
               value = arg.substring(12);
            }
            else if (arg.startsWith("--verbose="))
            {
               ctx = ARG_IDX_VERBOSE;
               value = arg.substring(10);
            }
            else
            {
               int idx = -1;

               for (int i=0; i<CMD_LINE_ARGS.length; i++)
               {
                  if (CMD_LINE_ARGS[i].equals(arg))
                  {
                     idx = i;
                     break;
                  }
               }

               if (idx != -1)
               {
                  ctx = idx;
                  continue;
               }

               printWarning(arg, "(unknown option).", verbose);
               continue;
            }
         }
         else
         {
            value = arg;
         }

         value = value.trim();

         switch (ctx)
         {
            case ARG_IDX_INPUT:
               inputName = value;
               break;

            case ARG_IDX_OUTPUT:
               outputName = value;
               break;

            case ARG_IDX_CODE_SIZE:
               try
               {
                  codeSize = Integer.parseInt(value);

                  if ((codeSize < LZWDecoder.MIN_ROOT_BITS) || (codeSize > LZWDecoder.MAX_ROOT_BITS))
                     throw new NumberFormatException();
               }
               catch (NumberFormatException e)
               {
                  System.err.println("Invalid code size provided on command line: "+value+
                     " (must be in ["+LZWDecoder.MIN_ROOT_BITS+".."+LZWDecoder.MAX_ROOT_BITS+"])");
                  return Error.ERR_INVALID_PARAM;
               }

               break;

            case ARG_IDX_BIT_ORDER:
               try
               {
                  order = BitOrder.getOrder(value);
               }
               catch (IllegalArgumentException e)
               {
                  System.err.println("Invalid bit order provided on command line: "+value);
                  return Error.ERR_INVALID_PARAM;
               }

               break;

            case ARG_IDX_VERBOSE:
               try
               {
                  verbose = Integer.parseInt(value);

                  if ((verbose < 0) || (verbose > 5))
                     throw new NumberFormatException();
               }
               catch (NumberFormatException e)
               {
                  System.err.println("Invalid verbosity level provided on command line: "+value);
                  return Error.ERR_INVALID_PARAM;
               }

               break;

            default:
               break;
         }

         ctx = -1;
      }

      if (ctx != -1)
         printWarning(CMD_LINE_ARGS[ctx], "with no value.", verbose);

      if ((showHelp == true) || (args.length == 0))
      {
         printHelp();
         return 0;
      }

      if (inputName.length() == 0)
      {
         System.err.println("Missing input file name: try --help or -h");
         return Error.ERR_MISSING_PARAM;
      }

      // Overwrite verbosity if the output goes to stdout
      if ((outputName.length() == 0) || "STDOUT".equalsIgnoreCase(outputName))
         verbose = 0;

      printOut("\n"+APP_HEADER+"\n", verbose>=1);
      printOut(APP_SUB_HEADER, verbose>1);

      map.put("inputName", inputName);
      map.put("outputName", outputName);
      map.put("codeSize", codeSize);
      map.put("bitOrder", order);
      map.put("overwrite", overwrite);
      map.put("verbose", verbose);
      return 0;
   }


   private static void printHelp()
   {
      printOut(APP_HEADER, true);
      printOut(APP_SUB_HEADER, true);
      printOut(APP_USAGE, true);
      printOut("", true);
      printOut("   -h, --help", true);
      printOut("        Display this message\n", true);
      printOut("   -i, --input=<inputName>", true);
      printOut("        Mandatory name of the raw LZW code stream file or 'stdin'\n", true);
      printOut("   -o, --output=<outputName>", true);
      printOut("        Optional name of the output file, 'stdout' (default) or 'none'\n", true);
      printOut("   -b, --code-size=<bits>", true);
      printOut("        Root code size in bits, in ["+LZWDecoder.MIN_ROOT_BITS+".."+LZWDecoder.MAX_ROOT_BITS+
         "] (default 8)\n", true);
      printOut("   -e, --bit-order=<order>", true);
      printOut("        Bit packing order: 'little' (GIF, default) or 'big' (TIFF, PDF)\n", true);
      printOut("   -v, --verbose=<level>", true);
      printOut("        0=silent, 1=default, 2=display details, 3=display configuration,", true);
      printOut("        4=display dictionary clears, 5=display all events\n", true);
      printOut("   -f, --force", true);
      printOut("        Overwrite the output file if it already exists\n", true);
      printOut("EG. java -jar lzw.jar -i frame0.lzw -o frame0.raw -b 8 -e little -v 2\n", true);
   }


   private static void printWarning(String val, String reason, int verbose)
   {
      String msg = String.format("Warning: Ignoring option [%s] %s", val, reason);
      printOut(msg, verbose>0);
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }
}
