package edu.isi.cfgtools;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UnsupportedEncodingException;
import java.io.Writer;
import java.util.Date;
// diagnostics to stderr. every method that logs keeps its own
// boolean debug flag and passes it in, so tracing is switched per method
public class Debug {

    private static String encoding = "utf-8";
    private static Writer w = null;
    // timing messages at or below this level get printed
    private static int dblevel = 0;

    public static synchronized void setEncoding(String s) {
	encoding = s;
	w = null;
    }
    public static synchronized void setDbLevel(int i) {
	dblevel = i;
    }
    public static synchronized int getDbLevel() {
	return dblevel;
    }

    private static Writer getWriter() {
	if (w == null) {
	    try {
		w = new OutputStreamWriter(System.err, encoding);
	    }
	    catch (UnsupportedEncodingException e) {
		System.err.println("Warning: encoding "+encoding+" not supported; using default");
		w = new OutputStreamWriter(System.err);
	    }
	}
	return w;
    }

    private static synchronized void emit(String s) {
	try {
	    Writer out = getWriter();
	    out.write(s);
	    out.write("\n");
	    out.flush();
	}
	catch (IOException e) {
	    System.err.println("IOException while trying to print "+s);
	}
    }

    // stuff we always print
    public static void prettyDebug(String s) {
	emit(s);
    }

    // tagged with the calling class and method
    public static void debug(boolean d, String s) {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	emit(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
    }
    // indented version, for nested fixpoint loops
    public static void debug(boolean d, int indent, String s) {
	if (!d)
	    return;
	StackTraceElement caller = new Throwable().getStackTrace()[1];
	StringBuilder sb = new StringBuilder();
	for (int x = 0; x < indent; x++)
	    sb.append(' ');
	sb.append(caller.getClassName()+":"+caller.getMethodName()+" : "+s);
	emit(sb.toString());
    }

    // print elapsed time since pta if the global level is at least needlevel
    public static void dbtime(int needlevel, Date pta, String msg) {
	if (getDbLevel() < needlevel)
	    return;
	long x = new Date().getTime() - pta.getTime();
	emit(msg+": "+x+" ms");
    }
}
