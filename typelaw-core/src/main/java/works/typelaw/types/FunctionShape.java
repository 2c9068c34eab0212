package works.typelaw.types;

import java.util.List;
import org.jetbrains.annotations.Nullable;

import static java.util.Objects.requireNonNull;

/**
 * A call or construct signature.
 *
 * @param parameters handle into the interner's parameter list table
 * @param thisType the declared <code>this</code> parameter, if any
 * @param method true for signatures declared with method syntax
 */
public record FunctionShape(
	List<TypeParamInfo> typeParameters,
	Handle<List<ParamInfo>> parameters,
	@Nullable TypeId thisType,
	TypeId returnType,
	boolean method
) {
	public FunctionShape {
		typeParameters = List.copyOf(typeParameters);
		requireNonNull(parameters);
		requireNonNull(returnType);
	}

	public boolean isGeneric() {
		return !typeParameters.isEmpty();
	}
}
