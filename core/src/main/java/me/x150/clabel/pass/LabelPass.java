package me.x150.clabel.pass;

import me.x150.clabel.exc.LabelingFailure;

public interface LabelPass {
	void run(FunctionScope scope) throws LabelingFailure;
}
