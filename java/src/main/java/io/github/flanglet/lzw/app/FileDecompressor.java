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

import java.io.BufferedInputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import io.github.flanglet.lzw.BitOrder;
import io.github.flanglet.lzw.Error;
import io.github.flanglet.lzw.Listener;
import io.github.flanglet.lzw.io.LZWIOException;
import io.github.flanglet.lzw.io.LZWInputStream;
import io.github.flanglet.lzw.io.NullOutputStream;



/**
 * Decompresses one raw LZW code stream file. The result of {@code call()}
 * is 0 on success or one of the {@link Error} codes.
 */
public class FileDecompressor implements Callable<Integer>
{
   private static final int DEFAULT_BUFFER_SIZE = 65536;
   private static final String STDOUT = "STDOUT";
   private static final String STDIN = "STDIN";
   private static final String NONE = "NONE";

   private int verbosity;
   private final boolean overwrite;
   private final String inputName;
   private final String outputName;
   private final int codeSize;
   private final BitOrder bitOrder;
   private final int bufferSize;
   private final List<Listener> listeners;
   private LZWInputStream lis;
   private OutputStream os;


   public FileDecompressor(Map<String, Object> map)
   {
      Boolean bForce = (Boolean) map.remove("overwrite");
      this.overwrite = (bForce == null) ? false : bForce;
      String iName = (String) map.remove("inputName");
      this.inputName = ((iName == null) || iName.isEmpty()) ? STDIN : iName;
      String oName = (String) map.remove("outputName");
      this.outputName = ((oName == null) || oName.isEmpty()) ? STDOUT : oName;
      Integer iVerbose = (Integer) map.remove("verbose");
      this.verbosity = (iVerbose == null) ? 1 : iVerbose;
      Integer iCodeSize = (Integer) map.remove("codeSize");
      this.codeSize = (iCodeSize == null) ? 8 : iCodeSize;
      BitOrder order = (BitOrder) map.remove("bitOrder");
      this.bitOrder = (order == null) ? BitOrder.LITTLE_ENDIAN : order;
      Integer iBufferSize = (Integer) map.remove("bufferSize");
      this.bufferSize = (iBufferSize == null) ? DEFAULT_BUFFER_SIZE : iBufferSize;
      this.listeners = new ArrayList<>(10);

      if ((this.verbosity > 0) && (map.size() > 0))
      {
         for (String k : map.keySet())
            printOut("Warning: Ignoring invalid option [" + k + "]", true);
      }
   }


   public boolean addListener(Listener bl)
   {
      return (bl != null) ? this.listeners.add(bl) : false;
   }


   public boolean removeListener(Listener bl)
   {
      return (bl != null) ? this.listeners.remove(bl) : false;
   }


   @Override
   public Integer call()
   {
      // Limit verbosity level when output is stdout
      if (STDOUT.equalsIgnoreCase(this.outputName))
         this.verbosity = 0;

      if (this.verbosity > 2)
      {
         printOut("Verbosity: "+this.verbosity, true);
         printOut("Overwrite: "+this.overwrite, true);
         printOut("Root code size: "+this.codeSize, true);
         printOut("Bit order: "+this.bitOrder, true);
         this.addListener(new InfoPrinter(this.verbosity, System.out));
      }

      if (this.verbosity > 2)
      {
         printOut("Input file name: '" + this.inputName + "'", true);
         printOut("Output file name: '" + this.outputName + "'", true);
      }

      printOut("\nDecompressing "+this.inputName+" ...", this.verbosity>1);
      int res = this.openOutput();

      if (res != 0)
         return res;

      InputStream is;

      try
      {
         is = (STDIN.equalsIgnoreCase(this.inputName)) ? System.in :
            new BufferedInputStream(new FileInputStream(new File(this.inputName)));
      }
      catch (Exception e)
      {
         System.err.println("Cannot open input file '"+ this.inputName+"': " + e.getMessage());
         this.closeQuietly();
         return Error.ERR_OPEN_FILE;
      }

      try
      {
         Map<String, Object> ctx = new HashMap<>();
         ctx.put("codeSize", this.codeSize);
         ctx.put("bitOrder", this.bitOrder);
         ctx.put("bufferSize", this.bufferSize);
         this.lis = new LZWInputStream(is, ctx);

         for (Listener bl : this.listeners)
            this.lis.addListener(bl);
      }
      catch (Exception e)
      {
         System.err.println("Cannot create decompressor: "+e.getMessage());
         this.closeQuietly();

         try
         {
            is.close();
         }
         catch (IOException e2)
         {
            // Ignore
         }

         return Error.ERR_CREATE_DECOMPRESSOR;
      }

      long decoded = 0;
      long before = System.nanoTime();

      try
      {
         byte[] buf = new byte[DEFAULT_BUFFER_SIZE];
         int n;

         while ((n = this.lis.read(buf, 0, buf.length)) > 0)
         {
            try
            {
               this.os.write(buf, 0, n);
               decoded += n;
            }
            catch (IOException e)
            {
               System.err.print("Failed to write decompressed data to file '"+this.outputName+"': ");
               System.err.println(e.getMessage());
               return Error.ERR_WRITE_FILE;
            }
         }

         if (this.lis.isComplete() == false)
            printOut("Warning: end of information code not found, the code stream may be truncated", this.verbosity>0);
      }
      catch (LZWIOException e)
      {
         System.err.println("An unexpected condition happened. Exiting ...");
         System.err.println(e.getMessage());
         return e.getErrorCode();
      }
      catch (Exception e)
      {
         System.err.println("An unexpected condition happened. Exiting ...");
         System.err.println(e.getMessage());
         return Error.ERR_UNKNOWN;
      }
      finally
      {
         // Close streams to ensure all data are flushed
         res = this.dispose();
      }

      if (res != 0)
         return res;

      long after = System.nanoTime();
      long delta = (after - before) / 1000000L; // convert to ms
      String str;

      if (delta >= 100000)
         str = String.format("%1$.1f", (float) delta/1000) + " s";
      else
         str = String.valueOf(delta) + " ms";

      if (this.verbosity > 1)
      {
         printOut("", true);
         printOut("Decompressing:          "+str, true);
         printOut("Input size:             "+this.lis.getRead(), true);
         printOut("Output size:            "+decoded, true);

         if (delta > 0)
            printOut("Throughput (KB/s): "+(((decoded * 1000L) >> 10) / delta), true);

         printOut("", true);
      }
      else if (this.verbosity == 1)
      {
         str = String.format("Decompressing %s: %d => %d in %s", this.inputName, this.lis.getRead(), decoded, str);
         printOut(str, true);
      }

      return 0;
   }


   private int openOutput()
   {
      if (NONE.equalsIgnoreCase(this.outputName))
      {
         this.os = new NullOutputStream();
         return 0;
      }

      if (STDOUT.equalsIgnoreCase(this.outputName))
      {
         this.os = System.out;
         return 0;
      }

      try
      {
         File output = new File(this.outputName);

         if (output.exists())
         {
            if (output.isDirectory())
            {
               System.err.println("The output file is a directory");
               return Error.ERR_OUTPUT_IS_DIR;
            }

            if (this.overwrite == false)
            {
               System.err.println("File '" + this.outputName + "' exists and " +
                  "the 'force' command line option has not been provided");
               return Error.ERR_OVERWRITE_FILE;
            }

            Path path1 = FileSystems.getDefault().getPath(this.inputName).toAbsolutePath();
            Path path2 = FileSystems.getDefault().getPath(this.outputName).toAbsolutePath();

            if (path1.equals(path2))
            {
               System.err.println("The input and output files must be different");
               return Error.ERR_CREATE_FILE;
            }
         }

         Path parent = output.getAbsoluteFile().toPath().getParent();

         if ((parent != null) && (Files.exists(parent) == false))
            Files.createDirectories(parent);

         this.os = new FileOutputStream(output);
         return 0;
      }
      catch (Exception e)
      {
         System.err.println("Cannot open output file '"+ this.outputName+"' for writing: " + e.getMessage());
         return Error.ERR_CREATE_FILE;
      }
   }


   // Close streams, report failures as an error code
   private int dispose()
   {
      int res = 0;

      try
      {
         if (this.lis != null)
            this.lis.close();
      }
      catch (IOException e)
      {
         System.err.println("Failed to close input file '"+this.inputName+"': "+e.getMessage());
         res = Error.ERR_READ_FILE;
      }

      try
      {
         if (this.os == System.out)
            this.os.flush();
         else if (this.os != null)
            this.os.close();
      }
      catch (IOException e)
      {
         System.err.println("Failed to close output file '"+this.outputName+"': "+e.getMessage());
         res = Error.ERR_WRITE_FILE;
      }

      return res;
   }


   private void closeQuietly()
   {
      try
      {
         if ((this.os != null) && (this.os != System.out))
            this.os.close();
      }
      catch (IOException e)
      {
         // Ignore
      }
   }


   private static void printOut(String msg, boolean print)
   {
      if ((print == true) && (msg != null))
         System.out.println(msg);
   }
}
