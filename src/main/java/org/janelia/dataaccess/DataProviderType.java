package org.janelia.dataaccess;

public enum DataProviderType
{
	FILESYSTEM
}
