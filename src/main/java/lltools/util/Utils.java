package lltools.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a collection.
	 *
	 * @param strs passed objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		StringBuilder builder = new StringBuilder();
		boolean first = true;
		for (T obj : strs){
			if (!first){
				builder.append(separator);
			}
			builder.append(obj);
			first = false;
		}
		return builder.toString();
	}

	@SafeVarargs
	public static <T> ArrayList<T> makeArrayList(T... elements){
		ArrayList<T> ret = new ArrayList<>(elements.length);
		for (int i = 0; i < elements.length; i++){
			ret.add(elements[i]);
		}
		return ret;
	}

	/**
	 * Concatenates the passed lists into a new list
	 */
	@SafeVarargs
	public static <T> List<T> concat(List<? extends T>... lists){
		List<T> ret = new ArrayList<>();
		for (List<? extends T> list : lists){
			ret.addAll(list);
		}
		return ret;
	}
}
